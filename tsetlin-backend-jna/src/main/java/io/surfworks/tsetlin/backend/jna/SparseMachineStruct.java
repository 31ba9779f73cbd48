package io.surfworks.tsetlin.backend.jna;

import com.sun.jna.Pointer;
import com.sun.jna.Structure;

/**
 * Leading fields of the engine's {@code struct SparseTsetlinMachine}, up to the tensor pointers.
 */
@Structure.FieldOrder({
        "numClasses", "threshold", "numLiterals", "numClauses",
        "maxState", "minState", "sparseInitState", "sparseMinState", "boostTruePositiveFeedback", "s",
        "ySize", "yElementSize", "yEq", "outputActivation", "calculateFeedback",
        "midState", "alRowSize", "sInv", "sMin1Inv",
        "taState", "activeLiterals", "weights", "clauseOutput", "votes"
})
public class SparseMachineStruct extends Structure {

    public int numClasses;
    public int threshold;
    public int numLiterals;
    public int numClauses;
    public byte maxState;
    public byte minState;
    public byte sparseInitState;
    public byte sparseMinState;
    public byte boostTruePositiveFeedback;
    public float s;

    public int ySize;
    public int yElementSize;
    public Pointer yEq;
    public Pointer outputActivation;
    public Pointer calculateFeedback;

    public byte midState;
    public byte alRowSize;
    public float sInv;
    public float sMin1Inv;

    /** one list head per clause */
    public Pointer taState;
    public Pointer activeLiterals;
    public Pointer weights;
    public Pointer clauseOutput;
    public Pointer votes;

    public SparseMachineStruct(Pointer machine) {
        super(machine);
        read();
    }
}
