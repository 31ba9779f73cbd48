package io.surfworks.tsetlin.backend.jna;

import com.sun.jna.Pointer;
import com.sun.jna.Structure;

/**
 * Leading fields of the engine's {@code struct TsetlinMachine}, up to the tensor pointers.
 * The PRNG state that follows is not mirrored.
 */
@Structure.FieldOrder({
        "numClasses", "threshold", "numLiterals", "numClauses",
        "maxState", "minState", "boostTruePositiveFeedback", "s",
        "ySize", "yElementSize", "yEq", "outputActivation", "calculateFeedback",
        "midState", "sInv", "sMin1Inv",
        "taState", "weights", "clauseOutput", "votes"
})
public class DenseMachineStruct extends Structure {

    public int numClasses;
    public int threshold;
    public int numLiterals;
    public int numClauses;
    public byte maxState;
    public byte minState;
    public byte boostTruePositiveFeedback;
    public float s;

    public int ySize;
    public int yElementSize;
    public Pointer yEq;
    public Pointer outputActivation;
    public Pointer calculateFeedback;

    public byte midState;
    public float sInv;
    public float sMin1Inv;

    /** int8, (clauses, literals, 2) or (clauses, 2, literals) depending on the engine build */
    public Pointer taState;
    /** int16, (clauses, classes) */
    public Pointer weights;
    public Pointer clauseOutput;
    public Pointer votes;

    public DenseMachineStruct(Pointer machine) {
        super(machine);
        read();
    }
}
