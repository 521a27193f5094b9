package org.calista.metatot.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * MetaToTLogFmt — компактный helper для "коробочного" форматирования
 * конфигурации оркестратора и выбранного пути.
 */
public final class MetaToTLogFmt {

    private MetaToTLogFmt() {}

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(32);

        public BoxBuilder kv(String key, Object value) {
            String k = (key == null) ? "" : key;
            lines.add(k + ": " + value);
            return this;
        }

        public BoxBuilder line(String text) {
            lines.add(text == null ? "" : text);
            return this;
        }

        public BoxBuilder sep() {
            lines.add("--");
            return this;
        }
    }

    private static String renderBox(String title, List<String> lines) {
        int contentWidth = title.length();
        for (String l : lines) {
            if ("--".equals(l)) continue;
            contentWidth = Math.max(contentWidth, l.length());
        }
        int w = Math.max(24, contentWidth + 2);

        StringBuilder out = new StringBuilder((lines.size() + 5) * (w + 8));
        out.append("┌").append("─".repeat(w)).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append("├").append("─".repeat(w)).append("┤\n");
        for (String l : lines) {
            if ("--".equals(l)) {
                out.append("│").append("─".repeat(w)).append("│\n");
                continue;
            }
            out.append("│ ").append(padRight(l, w - 1)).append("│\n");
        }
        out.append("└").append("─".repeat(w)).append("┘");
        return out.toString();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
