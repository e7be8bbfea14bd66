/**
 * This package contains the control flow graph representation executed by
 * the interpreter.
 *
 * <p>
 * To define control-flow graphs for a specific procedure
 * see {@link com.galois.reve.cfg.Procedure}.  It can then be run with
 * {@link com.galois.reve.Interpreter#interpretFunction}.
 */
package com.galois.reve.cfg;
