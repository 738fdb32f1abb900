package io.lapse4j.core;

/**
 * A transform failed inside a worker. Carries the failing item and the original exception as cause, so the
 * failure reads the same whether it crossed a pool boundary or not.
 */
public class TransformException extends RuntimeException {

    private final transient Object item;
    private final int itemIndex;

    public TransformException(Object item, int itemIndex, Throwable cause) {
        super(describe(item, itemIndex, cause), cause);
        this.item = item;
        this.itemIndex = itemIndex;
    }

    public Object item() {
        return item;
    }

    public int itemIndex() {
        return itemIndex;
    }

    private static String describe(Object item, int itemIndex, Throwable cause) {
        return "transform failed for item #" + itemIndex + " (" + item + "): "
                + cause.getClass().getName() + ": " + cause.getMessage();
    }
}
