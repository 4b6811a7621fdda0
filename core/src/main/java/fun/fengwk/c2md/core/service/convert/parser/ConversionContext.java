package fun.fengwk.c2md.core.service.convert.parser;

import fun.fengwk.c2md.core.service.convert.model.AssetReference;
import fun.fengwk.c2md.core.service.convert.support.AssetLocator;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one document conversion. Never shared between documents.
 *
 * @author fengwk
 */
public class ConversionContext {

    private final Document document;
    private final AssetLocator assetLocator;
    private final SlugRegistry slugRegistry;
    private final Set<Node> processed = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<AssetReference> assets = new LinkedHashSet<>();
    private final Set<String> warnings = new LinkedHashSet<>();

    public ConversionContext(Document document, AssetLocator assetLocator) {
        this.document = document;
        this.slugRegistry = new SlugRegistry(document);
        this.assetLocator = assetLocator == null ? AssetLocator.unrestricted() : assetLocator;
    }

    public Document getDocument() {
        return document;
    }

    public AssetLocator getAssetLocator() {
        return assetLocator;
    }

    public SlugRegistry getSlugRegistry() {
        return slugRegistry;
    }

    /**
     * Marks a node as processed.
     *
     * @return true if the node was not processed before
     */
    public boolean markProcessed(Node node) {
        return processed.add(node);
    }

    public boolean isProcessed(Node node) {
        return processed.contains(node);
    }

    public void markSubtreeProcessed(Element element) {
        for (Element descendant : element.getAllElements()) {
            processed.add(descendant);
        }
    }

    public void addAsset(AssetReference asset) {
        assets.add(asset);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<AssetReference> getAssets() {
        return List.copyOf(assets);
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

}
