/**
 * The concrete interpreter used by the dynamic half of the regression
 * verifier.
 *
 * <p>
 * To produce a trace, build a {@link com.galois.reve.cfg.Procedure}, create a
 * {@link com.galois.reve.Interpreter} for a {@link com.galois.reve.RunConfig},
 * and call
 * {@link com.galois.reve.Interpreter#interpretFunction(com.galois.reve.cfg.Procedure, Environment, int)}.
 * The resulting {@link com.galois.reve.Call} can be serialized with
 * {@link com.galois.reve.TraceFormat}.
 */
package com.galois.reve;
