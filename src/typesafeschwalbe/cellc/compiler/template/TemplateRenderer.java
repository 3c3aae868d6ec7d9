package typesafeschwalbe.cellc.compiler.template;

import java.util.List;
import java.util.Map;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;

// all slots are checked before any text is produced
public class TemplateRenderer {

    public static Error incompleteRenderContextError(
        Skeleton skeleton, String slot
    ) {
        return new Error(
            Error.Kind.INCOMPLETE_RENDER_CONTEXT,
            "No value for the slot '" + slot + "' of the skeleton '"
                + skeleton.targetName() + "/v" + skeleton.version() + "/"
                + skeleton.fileName() + "'",
            List.of(slot)
        );
    }

    public static String render(Skeleton skeleton, Map<String, String> slots)
            throws ErrorException {
        List<Skeleton.Segment> segments = skeleton.segments();
        for(Skeleton.Segment segment: segments) {
            if(segment.isSlot() && slots.get(segment.content()) == null) {
                throw new ErrorException(
                    TemplateRenderer.incompleteRenderContextError(
                        skeleton, segment.content()
                    )
                );
            }
        }
        StringBuilder out = new StringBuilder();
        for(Skeleton.Segment segment: segments) {
            out.append(
                segment.isSlot()
                    ? slots.get(segment.content())
                    : segment.content()
            );
        }
        return out.toString();
    }

    private TemplateRenderer() {}

}
