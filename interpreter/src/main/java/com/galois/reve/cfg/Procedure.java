package com.galois.reve.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.reve.Type;

/**
 * A control-flow graph of one function.
 */
public final class Procedure {
    // Source of procedure ids, so that arguments and results of different
    // procedures never compare equal.
    private static long nextId = 0;

    private final long id;

    private final String name;

    /** List of expressions in function. */
    private final List<FunctionArg> arguments;

    private final Type returnType;

    /** Entry block for this procedure. */
    private final Block entryBlock;

    /** List of all blocks allocated in Cfg. */
    private final List<Block> blocks;

    private static synchronized long freshId() {
        return nextId++;
    }

    /**
     * Create a new control-flow graph whose arguments are named
     * <code>arg0</code>, <code>arg1</code>, and so on.
     * @param name name of the function
     * @param argTypes types of the arguments to the function
     * @param returnType type of the return value of the function
     */
    public Procedure(String name, Type[] argTypes, Type returnType) {
        this(name, defaultArgNames(argTypes.length), argTypes, returnType);
    }

    /**
     * Create a new control-flow graph.
     * @param name name of the function
     * @param argNames names of the arguments to the function
     * @param argTypes types of the arguments to the function
     * @param returnType type of the return value of the function
     */
    public Procedure(String name, String[] argNames, Type[] argTypes, Type returnType) {
        if (name == null) throw new NullPointerException("name");
        if (returnType == null) throw new NullPointerException("returnType");
        if (argNames.length != argTypes.length) {
            throw new IllegalArgumentException("Argument names and types differ in length.");
        }
        this.id = freshId();
        this.name = name;
        this.returnType = returnType;

        int argCount = argTypes.length;
        this.arguments = new ArrayList<FunctionArg>(argCount);
        // Populate argument list.
        for (int i = 0; i != argCount; ++i) {
            if (argTypes[i] == null || argTypes[i].isVoid()) {
                throw new IllegalArgumentException("Bad type for argument " + i + ".");
            }
            arguments.add(new FunctionArg(id, i, argTypes[i], argNames[i]));
        }

        this.entryBlock = new Block(this, 0, "entry");
        this.blocks = new ArrayList<Block>();
        this.blocks.add(entryBlock);
    }

    private static String[] defaultArgNames(int n) {
        String[] r = new String[n];
        for (int i = 0; i != n; ++i) {
            r[i] = "arg" + i;
        }
        return r;
    }

    long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Type getReturnType() {
        return returnType;
    }

    /**
     * Get first block.
     * @return the block
     */
    public Block getEntryBlock() {
        return entryBlock;
    }

    /**
     * Return number of arguments expected by procedure.
     * @return the number of arguments
     */
    public int getArgCount() {
        return arguments.size();
    }

    /**
     * Returns expression representing argument for function.
     * @param i the index of the argument.
     * @return the argument.
     */
    public FunctionArg getArg(int i) {
        if (!(0 <= i && i < arguments.size())) {
            throw new IllegalArgumentException("Bad argument index.");
        }
        return arguments.get(i);
    }

    public List<FunctionArg> getArgs() {
        return Collections.unmodifiableList(arguments);
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Create a new basic block named after its index.
     * @return the block
     */
    public Block newBlock() {
        return newBlock("bb" + blocks.size());
    }

    /**
     * Create a new basic block.
     * @param name the name recorded for the block
     * @return the block
     */
    public Block newBlock(String name) {
        if (name == null) throw new NullPointerException("name");
        Block b = new Block(this, blocks.size(), name);
        blocks.add(b);
        return b;
    }

    public String toString() {
        return name;
    }
}
