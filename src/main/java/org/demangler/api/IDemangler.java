package org.demangler.api;

import org.demangler.tree.Node;

/**
 * Defines the public interface for decoding mangled symbols.
 */
public interface IDemangler {

    /**
     * Decodes a mangled symbol into a tree. Decoding never fails: input that does not follow
     * the encoding yields a single {@link org.demangler.tree.NodeKind#FAILURE} node holding the input.
     *
     * @param mangled The encoded symbol, with or without the {@code _T} marker.
     * @param options The options of the decode.
     * @return The sealed root of the decoded tree.
     */
    Node decodeToTree(String mangled, DemangleOptions options);

    /**
     * Renders a tree to text. The tree is not modified.
     *
     * @param tree The root of the tree.
     * @param options The rendering options.
     * @return The rendered text.
     */
    String renderTree(Node tree, DemangleOptions options);

    /**
     * Decodes a symbol and renders the result.
     * @param mangled The encoded symbol.
     * @param options The options of the decode and the rendering.
     * @return The readable text, or the input itself if it could not be decoded.
     */
    default String decodeToText(String mangled, DemangleOptions options) {
        return renderTree(decodeToTree(mangled, options), options);
    }

    default Node decodeToTree(String mangled) {
        return decodeToTree(mangled, DemangleOptions.defaults());
    }

    default String renderTree(Node tree) {
        return renderTree(tree, DemangleOptions.defaults());
    }

    default String decodeToText(String mangled) {
        return decodeToText(mangled, DemangleOptions.defaults());
    }
}
