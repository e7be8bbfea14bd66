package com.galois.reve.cfg;

import com.galois.reve.Type;

/**
 * An expression obtained by evaluating a statement.
 */
public final class StatementResult implements Expr {
    final long procedureId;
    final int blockIndex;
    final int statementIndex;
    final Type type;
    private String name;

    StatementResult(long procedureId, int blockIndex, int statementIndex, Type type) {
        if (type == null) {
            throw new NullPointerException("type is null.");
        }
        this.procedureId = procedureId;
        this.blockIndex = blockIndex;
        this.statementIndex = statementIndex;
        this.type = type;
        this.name = "%" + blockIndex + "." + statementIndex;
    }

    public Type type() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * Set the name recorded for this result.  The name does not take part in
     * equality.
     * @param name the new name
     * @return this result
     */
    public StatementResult setName(String name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
        return this;
    }

    public String toString() {
        return name;
    }

    public boolean equals(Object o) {
        if (!(o instanceof StatementResult)) return false;
        StatementResult r = (StatementResult) o;
        return procedureId == r.procedureId
            && blockIndex == r.blockIndex
            && statementIndex == r.statementIndex;
    }

    public int hashCode() {
        return (int) (procedureId * 961 + blockIndex * 31 + statementIndex);
    }
}
