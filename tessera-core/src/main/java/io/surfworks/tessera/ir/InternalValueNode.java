package io.surfworks.tessera.ir;

/**
 * Carries an opaque payload into an internal input slot (slot names start with
 * {@code _}), such as the branch builders of a conditional.
 *
 * <p>Internal nodes have no tensor type, are excluded from
 * {@link OperationNode#inputs()} and never take part in value classification.
 */
public class InternalValueNode extends ValueNode {

    private final Object payload;

    public InternalValueNode(String name, Object payload) {
        super(name, null, null, null, -1);
        this.payload = payload;
    }

    public Object payload() {
        return payload;
    }

    /**
     * The payload cast to {@code type}.
     *
     * @throws ClassCastException if the payload is of another type
     */
    public <T> T payload(Class<T> type) {
        return type.cast(payload);
    }
}
