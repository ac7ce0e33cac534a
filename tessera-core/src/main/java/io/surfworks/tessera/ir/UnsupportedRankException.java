package io.surfworks.tessera.ir;

/**
 * A list output holds elements of a rank the IR cannot represent.
 */
public class UnsupportedRankException extends TesseraException {

    /** Highest element rank a list output may carry. */
    public static final int MAX_LIST_ELEMENT_RANK = 4;

    private final String output;
    private final int rank;

    public UnsupportedRankException(String opName, String kind, String output, int rank) {
        super(String.format("outputs list %s of rank %d tensors; lists support element rank <= %d",
                output, rank, MAX_LIST_ELEMENT_RANK), opName, kind);
        this.output = output;
        this.rank = rank;
    }

    public String getOutput() {
        return output;
    }

    public int getRank() {
        return rank;
    }
}
