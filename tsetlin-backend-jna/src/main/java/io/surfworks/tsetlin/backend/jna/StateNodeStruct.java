package io.surfworks.tsetlin.backend.jna;

import com.sun.jna.Pointer;
import com.sun.jna.Structure;

/**
 * One node of a sparse clause list: {@code struct TAStateNode}.
 */
@Structure.FieldOrder({"taId", "taState", "next"})
public class StateNodeStruct extends Structure {

    public int taId;
    public byte taState;
    public Pointer next;

    public StateNodeStruct(Pointer node) {
        super(node);
        read();
    }
}
