package me.christianrobert.pysourcegen.unparser.builder;

/**
 * Writes a separator before every item except the first one actually written.
 *
 * <p>Uses a one-shot flag rather than the item position, so optional items that are skipped
 * never produce a leading or doubled separator.</p>
 */
public final class Separator {

    private final PythonSourceBuilder b;
    private final String text;
    private boolean wanted;

    Separator(PythonSourceBuilder b, String text) {
        this.b = b;
        this.text = text;
    }

    /**
     * Call before writing each item.
     */
    public void next() {
        if (wanted) {
            b.write(text);
        } else {
            wanted = true;
        }
    }

    /**
     * @return true once at least one item has been announced
     */
    public boolean hasItems() {
        return wanted;
    }
}
