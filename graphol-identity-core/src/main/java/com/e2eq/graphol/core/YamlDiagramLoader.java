package com.e2eq.graphol.core;

import com.e2eq.graphol.exceptions.DiagramMalformedException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds a {@link Diagram} from a YAML description of its nodes and edges, then identifies it.
 * <p>
 * Kinds and identities use the Graphol item names ({@code range-restriction}, {@code value-domain},
 * {@code membership}, ...). Identification is suspended while the graph is assembled so that the
 * declared identities are what the final pass starts from.
 * </p>
 */
public final class YamlDiagramLoader {

    private static final Logger LOG = Logger.getLogger(YamlDiagramLoader.class);

    // DTOs mirroring YAML
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YDiagram(String name, List<YNode> nodes, List<YEdge> edges) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YNode(String id, String kind, String identity) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YEdge(String id, String kind, String source, String target) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final IdentityResolver resolver;

    public YamlDiagramLoader() {
        this(new BreadthFirstIdentityResolver());
    }

    public YamlDiagramLoader(IdentityResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public Diagram loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toDiagram(mapper.readValue(in, YDiagram.class), resourcePath);
        }
    }

    public Diagram loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toDiagram(mapper.readValue(in, YDiagram.class), path.getFileName().toString());
        }
    }

    public Diagram load(InputStream in) throws IOException {
        return toDiagram(mapper.readValue(in, YDiagram.class), "diagram");
    }

    private Diagram toDiagram(YDiagram y, String fallbackName) {
        String name = y.name() != null && !y.name().isBlank() ? y.name() : fallbackName;
        Diagram diagram = new Diagram(name, resolver);
        diagram.setAutoIdentify(false);

        for (YNode n : Optional.ofNullable(y.nodes()).orElse(List.of())) {
            requireId(n.id(), "node");
            NodeKind kind = parse(n.id(), "node kind", () -> NodeKind.fromLabel(required(n.id(), "kind", n.kind())));
            Identity identity = n.identity() == null || n.identity().isBlank()
                    ? null
                    : parse(n.id(), "identity", () -> Identity.fromLabel(n.identity()));
            DiagramNode node = diagram.addNode(n.id(), kind, identity);
            if (identity != null && node.identity() != identity) {
                throw new DiagramMalformedException(n.id(), "Node '" + n.id() + "' of kind " + kind.label()
                        + " cannot hold identity " + identity.label());
            }
        }

        for (YEdge e : Optional.ofNullable(y.edges()).orElse(List.of())) {
            requireId(e.id(), "edge");
            EdgeKind kind = parse(e.id(), "edge kind", () -> EdgeKind.fromLabel(required(e.id(), "kind", e.kind())));
            diagram.addEdge(e.id(), kind, required(e.id(), "source", e.source()), required(e.id(), "target", e.target()));
        }

        DiagramValidator.validate(diagram);
        diagram.setAutoIdentify(true);
        diagram.identifyAll();

        LOG.infof("Loaded diagram %s: %d nodes, %d edges", name, diagram.nodes().size(), diagram.edges().size());
        return diagram;
    }

    private static void requireId(String id, String what) {
        if (id == null || id.isBlank()) {
            throw new DiagramMalformedException("Every " + what + " needs a non-empty id");
        }
    }

    private static String required(String itemId, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new DiagramMalformedException(itemId, "Item '" + itemId + "' is missing '" + field + "'");
        }
        return value;
    }

    private interface Parser<T> {
        T parse();
    }

    private static <T> T parse(String itemId, String what, Parser<T> parser) {
        try {
            return parser.parse();
        } catch (IllegalArgumentException iae) {
            throw new DiagramMalformedException(itemId, "Invalid " + what + " on item '" + itemId + "': " + iae.getMessage(), iae);
        }
    }
}
