package typesafeschwalbe.cellc.compiler.template;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public record Skeleton(
    String targetName, int version, String fileName, String text
) {

    public static record Segment(boolean isSlot, String content) {}

    public static final String RESOURCE_ROOT = "/typesafeschwalbe/cellc/templates/";

    public static Skeleton load(String targetName, int version, String fileName) {
        String path = RESOURCE_ROOT + targetName + "/v" + version + "/" + fileName;
        try(InputStream in = Skeleton.class.getResourceAsStream(path)) {
            if(in == null) {
                throw new IllegalStateException(
                    "The skeleton resource '" + path + "' does not exist!"
                );
            }
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new Skeleton(targetName, version, fileName, text);
        } catch(IOException e) {
            throw new UncheckedIOException(
                "Unable to read the skeleton resource '" + path + "'", e
            );
        }
    }

    private static boolean isSlotChar(char c) {
        return ('a' <= c && c <= 'z')
            || ('A' <= c && c <= 'Z')
            || ('0' <= c && c <= '9')
            || c == '_' || c == '-';
    }

    public List<Segment> segments() {
        List<Segment> segments = new ArrayList<>();
        int literalStart = 0;
        int charI = 0;
        while(charI < this.text.length()) {
            if(!this.text.startsWith("${", charI)) {
                charI += 1;
                continue;
            }
            int nameEnd = charI + 2;
            while(nameEnd < this.text.length()
                    && Skeleton.isSlotChar(this.text.charAt(nameEnd))) {
                nameEnd += 1;
            }
            boolean closed = nameEnd > charI + 2
                && nameEnd < this.text.length()
                && this.text.charAt(nameEnd) == '}';
            if(!closed) {
                charI += 2;
                continue;
            }
            if(charI > literalStart) {
                segments.add(new Segment(
                    false, this.text.substring(literalStart, charI)
                ));
            }
            segments.add(new Segment(
                true, this.text.substring(charI + 2, nameEnd)
            ));
            charI = nameEnd + 1;
            literalStart = charI;
        }
        if(literalStart < this.text.length()) {
            segments.add(new Segment(false, this.text.substring(literalStart)));
        }
        return segments;
    }

    public List<String> slots() {
        List<String> slots = new ArrayList<>();
        for(Segment segment: this.segments()) {
            if(segment.isSlot() && !slots.contains(segment.content())) {
                slots.add(segment.content());
            }
        }
        return slots;
    }

}
