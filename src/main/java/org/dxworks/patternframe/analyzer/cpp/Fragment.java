package org.dxworks.patternframe.analyzer.cpp;

/**
 * What a traversal step hands to its parent: nothing, or the text of a chain that is still open
 * together with the sink it feeds. An anonymous sink has no name.
 */
public final class Fragment {
    public static final Fragment NONE = new Fragment(false, null, "");

    private final boolean pending;
    private final String sinkName;
    private final String text;

    private Fragment(boolean pending, String sinkName, String text) {
        this.pending = pending;
        this.sinkName = sinkName;
        this.text = text;
    }

    public static Fragment pending(String sinkName, String text) {
        return new Fragment(true, sinkName, text);
    }

    public boolean isPending() {
        return pending;
    }

    public boolean isNamed() {
        return sinkName != null;
    }

    public String getSinkName() {
        return sinkName;
    }

    public String getText() {
        return text;
    }

    /**
     * This fragment's text followed by {@code next}'s; the sink stays this fragment's.
     */
    public Fragment append(Fragment next) {
        if (!pending) return next;
        if (!next.pending) return this;
        return new Fragment(true, sinkName, text + next.text);
    }

    @Override
    public String toString() {
        if (!pending) return "Fragment.NONE";
        return "Fragment[" + (isNamed() ? sinkName : "<anonymous>") + ": '" + text + "']";
    }
}
