package com.grigorchuk.core;

import com.grigorchuk.core.algebra.LayerEnumerator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable command line configuration shared by the console and graphical front-ends.
 *
 * @param limit              number of elements the breadth-first enumeration expands
 * @param grigorchukSelected {@code true} if {@code -grigorchuk} selected the Grigorchuk map
 * @param showLines          {@code false} after {@code -grig-nolines}
 * @param showLabels         {@code false} after {@code -grig-nolabels}
 */
public record GrigorchukOptions(int limit, boolean grigorchukSelected, boolean showLines, boolean showLabels) {

    public static final String SELECT_FLAG = "-grigorchuk";
    public static final String LIMIT_FLAG = "-grig-limit";
    public static final String NO_LINES_FLAG = "-grig-nolines";
    public static final String NO_LABELS_FLAG = "-grig-nolabels";

    public GrigorchukOptions {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
    }

    public static GrigorchukOptions defaults() {
        return new GrigorchukOptions(LayerEnumerator.DEFAULT_LIMIT, false, true, true);
    }

    public static GrigorchukOptions parse(String... args) {
        Objects.requireNonNull(args, "args");
        return parse(List.of(args));
    }

    public static GrigorchukOptions parse(List<String> args) {
        Objects.requireNonNull(args, "args");
        int limit = LayerEnumerator.DEFAULT_LIMIT;
        boolean selected = false;
        boolean lines = true;
        boolean labels = true;

        int index = 0;
        while (index < args.size()) {
            String option = args.get(index);
            if (SELECT_FLAG.equals(option)) {
                selected = true;
            } else if (LIMIT_FLAG.equals(option)) {
                if (index + 1 >= args.size()) {
                    throw new IllegalArgumentException(LIMIT_FLAG + " requires a value");
                }
                index++;
                try {
                    limit = Integer.parseInt(args.get(index));
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("Invalid " + LIMIT_FLAG + " value: " + args.get(index), ex);
                }
            } else if (NO_LINES_FLAG.equals(option)) {
                lines = false;
            } else if (NO_LABELS_FLAG.equals(option)) {
                labels = false;
            } else {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            }
            index++;
        }
        return new GrigorchukOptions(limit, selected, lines, labels);
    }

    public GrigorchukOptions withShowLines(boolean show) {
        return new GrigorchukOptions(limit, grigorchukSelected, show, showLabels);
    }

    public GrigorchukOptions withShowLabels(boolean show) {
        return new GrigorchukOptions(limit, grigorchukSelected, showLines, show);
    }

    public static String usage() {
        return "Usage: " + SELECT_FLAG + " [" + LIMIT_FLAG + " <elements>] [" + NO_LINES_FLAG + "] ["
                + NO_LABELS_FLAG + "]";
    }
}
