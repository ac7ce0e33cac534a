package io.surfworks.tessera.ir;

/**
 * Owner of an ordered sequence of operations.
 */
public interface OperationContainer {

    /**
     * Removes {@code op} from this container. The operation has already cleared
     * its consumer edges from every input by the time this is called.
     */
    void detach(OperationNode op);
}
