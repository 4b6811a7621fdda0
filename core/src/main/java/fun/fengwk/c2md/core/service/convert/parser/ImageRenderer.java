package fun.fengwk.c2md.core.service.convert.parser;

import fun.fengwk.c2md.core.service.convert.model.AssetKind;
import fun.fengwk.c2md.core.service.convert.model.AssetReference;
import fun.fengwk.c2md.core.service.convert.support.AssetPaths;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Renders img elements and records the local files they reference.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ImageRenderer {

    public static final String DEFAULT_ALT = "image";

    /**
     * @return markdown image, or an empty string when the image is dropped
     */
    public String render(Element image, ConversionContext context, String defaultAlt) {
        if (image.hasClass("emoticon")) {
            return emoticonText(image);
        }
        String src = image.attr("src").trim();
        if (src.isEmpty()) {
            src = image.attr("data-image-src").trim();
        }
        String alt = image.attr("alt").trim();
        if (alt.isEmpty()) {
            alt = defaultAlt;
        }
        if (src.isEmpty()) {
            context.addWarning("missing image: <empty src> alt=" + alt);
            return "";
        }
        String target = src;
        if (!AssetPaths.isRemote(src)) {
            target = AssetPaths.stripQuery(src);
            String reference = AssetPaths.sanitize(src);
            Optional<Path> located = reference.isEmpty() ? Optional.empty() : context.getAssetLocator().locate(reference);
            if (located.isEmpty()) {
                log.debug("image not located, src={}", src);
                context.addWarning("missing image: " + src);
                return "";
            }
            context.addAsset(new AssetReference(located.get(), reference, AssetKind.IMAGE));
        }
        return format(alt, AssetPaths.toExplicitRelative(target), image.attr("title").trim());
    }

    static String format(String alt, String target, String title) {
        StringBuilder builder = new StringBuilder("![")
            .append(alt.replace("[", "\\[").replace("]", "\\]"))
            .append("](")
            .append(target.replace(" ", "%20"));
        if (!title.isEmpty()) {
            builder.append(" \"").append(title.replace("\"", "\\\"")).append('"');
        }
        return builder.append(')').toString();
    }

    private String emoticonText(Element image) {
        for (String attribute : new String[] {"data-emoji-fallback", "data-emoji-shortname", "alt"}) {
            String value = image.attr(attribute).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

}
