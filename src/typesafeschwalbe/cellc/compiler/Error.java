package typesafeschwalbe.cellc.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record Error(
    Kind kind,
    String message,
    Optional<String> model,
    List<String> subjects,
    Marking[] markings
) {

    public enum Kind {
        MISSING_ROLE("missing-role"),
        AMBIGUOUS_ROLE("ambiguous-role"),
        CYCLIC_DEPENDENCY("cyclic-dependency"),
        UNBOUND_REFERENCE("unbound-reference"),
        UNSUPPORTED_OPERATOR("unsupported-operator"),
        INCOMPLETE_RENDER_CONTEXT("incomplete-render-context"),
        IDENTIFIER_COLLISION("identifier-collision"),
        INVALID_MODEL("invalid-model"),
        UNKNOWN_TARGET("unknown-target"),
        SYNTAX("syntax"),
        INVALID_ARGUMENT("invalid-argument"),
        IO("io");

        public final String code;

        private Kind(String code) {
            this.code = code;
        }
    }

    public static record Marking(Type type, Source location, String note) {

        private enum Type {
            ERROR('^', Color.RED),
            INFO('~', Color.BRIGHT_BLUE);

            private final char marker;
            private final String color;

            private Type(char marker, String color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(Source location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(Source location, String note) {
            return new Marking(Type.INFO, location, note);
        }

    }

    public Error(Kind kind, String message, Marking... markings) {
        this(kind, message, Optional.empty(), List.of(), markings);
    }

    public Error(
        Kind kind, String message, List<String> subjects, Marking... markings
    ) {
        this(kind, message, Optional.empty(), List.copyOf(subjects), markings);
    }

    public Error withModel(String modelName) {
        return new Error(
            this.kind, this.message, Optional.of(modelName), this.subjects,
            this.markings
        );
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.kind == other.kind
            && this.message.equals(other.message)
            && this.model.equals(other.model)
            && this.subjects.equals(other.subjects)
            && Arrays.equals(this.markings, other.markings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.kind, this.message, this.model, this.subjects,
            Arrays.hashCode(this.markings)
        );
    }

    @Override
    public String toString() {
        return "error[" + this.kind.code + "]: " + this.message
            + this.model.map(m -> " (model '" + m + "')").orElse("");
    }

    public String render(Map<String, String> files, boolean colored) {
        String errorColor = colored? Color.from(Color.BOLD, Color.RED) : "";
        String messageColor = colored? Color.from(Color.RED) : "";
        String noteColor = colored? Color.from(Color.GRAY) : "";
        String plainColor = colored? Color.from() : "";
        StringBuilder output = new StringBuilder();
        output.append(errorColor);
        output.append("error[");
        output.append(this.kind.code);
        output.append("]: ");
        output.append(messageColor);
        output.append(this.message);
        output.append("\n");
        if(this.model.isPresent()) {
            output.append(noteColor);
            output.append("  in model '");
            output.append(this.model.get());
            output.append("'\n");
        }
        if(!this.subjects.isEmpty()) {
            output.append(noteColor);
            output.append("  involving: ");
            output.append(String.join(", ", this.subjects));
            output.append("\n");
        }
        for(Marking marked: this.markings) {
            String fileContent = files.get(marked.location.file());
            if(fileContent == null) {
                throw new IllegalArgumentException(
                    "An error source location refers to a file"
                        + " that is not present in the provided files!"
                );
            }
            Error.renderMarking(marked, fileContent, files, colored, output);
        }
        output.append(plainColor);
        return output.toString();
    }

    private static void renderMarking(
        Marking marked, String fileContent, Map<String, String> files,
        boolean colored, StringBuilder output
    ) {
        String gutterColor = colored? Color.from(Color.GRAY) : "";
        String lineColor = colored? Color.from() : "";
        String markColor = colored? Color.from(marked.type.color) : "";
        List<Integer> lineStarts = new ArrayList<>();
        lineStarts.add(0);
        for(int charI = 0; charI < fileContent.length(); charI += 1) {
            if(fileContent.charAt(charI) == '\n') {
                lineStarts.add(charI + 1);
            }
        }
        int startLine = marked.location.computeLine(files) - 1;
        int endOffset = Math.max(
            marked.location.startOffset() + 1, marked.location.endOffset()
        );
        String lineNumber = String.valueOf(startLine + 1);
        output.append(gutterColor);
        output.append(" ".repeat(lineNumber.length() + 1));
        output.append("╭─ ");
        output.append(marked.location.file());
        output.append(":");
        output.append(startLine + 1);
        output.append(":");
        output.append(marked.location.computeColumn(files));
        output.append("\n");
        for(int lineI = startLine; lineI < lineStarts.size(); lineI += 1) {
            int lineStart = lineStarts.get(lineI);
            if(lineStart >= endOffset && lineI > startLine) { break; }
            int lineEnd = lineI + 1 < lineStarts.size()
                ? lineStarts.get(lineI + 1) - 1
                : fileContent.length();
            String line = fileContent.substring(lineStart, lineEnd)
                .replace("\r", "");
            String displayedNumber = String.valueOf(lineI + 1);
            output.append(gutterColor);
            output.append(" ".repeat(
                lineNumber.length() - Math.min(
                    lineNumber.length(), displayedNumber.length()
                )
            ));
            output.append(displayedNumber);
            output.append(" │ ");
            output.append(lineColor);
            output.append(line);
            output.append("\n");
            output.append(gutterColor);
            output.append(" ".repeat(lineNumber.length() + 1));
            output.append("┊ ");
            output.append(markColor);
            for(int charI = lineStart; charI < lineStart + line.length();
                    charI += 1) {
                boolean isMarked = charI >= marked.location.startOffset()
                    && charI < endOffset;
                output.append(isMarked? marked.type.marker : ' ');
            }
            if(lineEnd >= endOffset || lineI + 1 == lineStarts.size()) {
                output.append(" ");
                output.append(marked.note);
            }
            output.append("\n");
        }
        output.append(gutterColor);
        output.append(" ".repeat(lineNumber.length()));
        output.append("─╯\n");
    }

}
