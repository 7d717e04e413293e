package org.demangler.api;

import com.typesafe.config.Config;
import org.demangler.diagnostics.DiagnosticsEngine;
import org.demangler.frontend.DemangleException;
import org.demangler.frontend.parser.Parser;
import org.demangler.printer.NodePrinter;
import org.demangler.tree.Node;
import org.demangler.tree.NodeKind;
import org.demangler.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The main implementation of the {@link IDemangler} interface.
 * It runs a fresh {@link Parser} per symbol and turns every decoding error into a
 * {@link NodeKind#FAILURE} result.
 * <p>
 * Instances hold no mutable state and can be shared between threads.
 */
public class Demangler implements IDemangler {

    private static final Logger LOG = LoggerFactory.getLogger(Demangler.class);

    /**
     * The highest nesting limit that can be configured. Decoding, sealing, copying and printing
     * all recurse once per level, and deeper trees would overflow a default thread stack.
     */
    public static final int MAX_RECURSION_DEPTH = 1024;

    /** The nesting limit used when none is configured. */
    public static final int DEFAULT_MAX_RECURSION_DEPTH = MAX_RECURSION_DEPTH;

    private static final String MAX_DEPTH_PATH = "demangler.max-recursion-depth";

    private final int maxRecursionDepth;

    public Demangler() {
        this(DEFAULT_MAX_RECURSION_DEPTH);
    }

    /**
     * Creates a demangler with an explicit nesting limit.
     * @param maxRecursionDepth The deepest nesting of types and contexts that is decoded.
     * @throws IllegalArgumentException if the limit is not positive or exceeds {@link #MAX_RECURSION_DEPTH}.
     */
    public Demangler(int maxRecursionDepth) {
        if (maxRecursionDepth <= 0) {
            throw new IllegalArgumentException("Recursion depth limit must be positive, got " + maxRecursionDepth);
        }
        if (maxRecursionDepth > MAX_RECURSION_DEPTH) {
            throw new IllegalArgumentException("Recursion depth limit must not exceed " + MAX_RECURSION_DEPTH
                    + ", got " + maxRecursionDepth);
        }
        this.maxRecursionDepth = maxRecursionDepth;
    }

    /**
     * Creates a demangler from the {@code demangler} section of a configuration.
     * @param config The root configuration.
     * @return The configured demangler.
     * @throws IllegalArgumentException if the configured limit is out of range.
     */
    public static Demangler fromConfig(Config config) {
        int depth = config.hasPath(MAX_DEPTH_PATH) ? config.getInt(MAX_DEPTH_PATH) : DEFAULT_MAX_RECURSION_DEPTH;
        LOG.debug("Creating demangler with recursion depth limit {}", depth);
        return new Demangler(depth);
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    @Override
    public Node decodeToTree(String mangled, DemangleOptions options) {
        return decodeToTree(mangled, options, null);
    }

    /**
     * Decodes a symbol and reports why decoding failed, if it did.
     *
     * @param mangled The encoded symbol.
     * @param options The options of the decode.
     * @param diagnostics Receives one error per failed decode. Can be null.
     * @return The sealed root of the decoded tree, or a {@link NodeKind#FAILURE} node.
     */
    public Node decodeToTree(String mangled, DemangleOptions options, DiagnosticsEngine diagnostics) {
        Objects.requireNonNull(mangled, "mangled");
        Objects.requireNonNull(options, "options");
        try {
            Node root = new Parser(mangled, maxRecursionDepth).parse();
            if (LOG.isTraceEnabled()) {
                LOG.trace("Demangled '{}' into {} nodes", mangled, TreeWalker.countNodes(root));
            }
            return root.seal();
        } catch (DemangleException e) {
            LOG.debug("Failed to demangle '{}' at offset {}: {}", mangled, e.getOffset(), e.getMessage());
            if (diagnostics != null) {
                diagnostics.reportError(e.getCode(), e.getMessage(), mangled, e.getOffset());
            }
            return Node.create(NodeKind.FAILURE, mangled).seal();
        }
    }

    @Override
    public String renderTree(Node tree, DemangleOptions options) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(options, "options");
        return new NodePrinter(options).print(tree);
    }
}
