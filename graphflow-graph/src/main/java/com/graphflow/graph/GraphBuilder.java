package com.graphflow.graph;

import com.graphflow.graph.descriptor.EdgeDescriptor;
import com.graphflow.graph.descriptor.GraphDescriptor;
import com.graphflow.graph.descriptor.GuardDescriptor;
import com.graphflow.graph.descriptor.NodeDescriptor;
import com.graphflow.node.ExecutionCapability;
import com.graphflow.node.GuardFactory;
import com.graphflow.node.GuardPredicate;
import com.graphflow.node.NodeDefinition;
import com.graphflow.node.NodeFactory;
import com.graphflow.node.NodeImplementation;
import com.graphflow.registry.ComponentRegistries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns a {@link GraphDescriptor} into a validated {@link GraphModel}.
 * <p>
 * Order of checks:
 * <ol>
 *   <li>Structure (ids, entry point, edge endpoints, join targets, end-marker edges): all problems are
 *       collected and thrown together as {@link GraphValidationException}.</li>
 *   <li>Type resolution against the registries: an unregistered node or guard type throws
 *       {@link com.graphflow.registry.UnknownTypeException}.</li>
 *   <li>Capability narrowing: a declared capability the implementation does not support is an error.</li>
 *   <li>Reachability from the entry point: unreachable nodes are warnings, errors in strict mode.</li>
 * </ol>
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private static final String DEFAULT_WORKFLOW_ID = "workflow";

    private final ComponentRegistries registries;
    private final boolean strict;

    public GraphBuilder(ComponentRegistries registries) {
        this(registries, false);
    }

    public GraphBuilder(ComponentRegistries registries, boolean strict) {
        this.registries = Objects.requireNonNull(registries, "registries");
        this.strict = strict;
    }

    public GraphModel build(GraphDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        String workflowId = descriptor.getWorkflowId() != null && !descriptor.getWorkflowId().isBlank()
                ? descriptor.getWorkflowId() : DEFAULT_WORKFLOW_ID;

        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> nodeIds = checkNodes(descriptor, issues);
        checkEntryPoint(descriptor, nodeIds, issues);
        checkEdges(descriptor, nodeIds, issues);
        throwIfErrors(workflowId, issues);

        List<Node> nodes = new ArrayList<>();
        for (NodeDescriptor nd : descriptor.getNodes()) {
            nodes.add(buildNode(nd, issues));
        }
        List<Edge> edges = new ArrayList<>();
        int index = 0;
        for (EdgeDescriptor ed : descriptor.getEdges()) {
            edges.add(buildEdge(index++, ed));
        }
        throwIfErrors(workflowId, issues);

        GraphModel probe = new GraphModel(workflowId, nodes, edges, descriptor.getEntryPoint(), null, null);
        Set<String> reachable = probe.reachableFrom(descriptor.getEntryPoint());
        for (Node n : nodes) {
            if (!reachable.contains(n.getId())) {
                String msg = "Node is not reachable from entry point " + descriptor.getEntryPoint();
                issues.add(strict
                        ? ValidationIssue.error("UNREACHABLE_NODE", n.getId(), msg)
                        : ValidationIssue.warning("UNREACHABLE_NODE", n.getId(), msg));
            }
        }
        throwIfErrors(workflowId, issues);

        for (ValidationIssue warning : issues) {
            log.warn("Graph validation warning | workflowId={} | {}", workflowId, warning);
        }
        GraphModel model = new GraphModel(workflowId, nodes, edges, descriptor.getEntryPoint(),
                descriptor.getMetadata(), issues);
        log.debug("Graph built | workflowId={} | nodes={} | edges={} | warnings={}",
                workflowId, nodes.size(), edges.size(), issues.size());
        return model;
    }

    private static Set<String> checkNodes(GraphDescriptor descriptor, List<ValidationIssue> issues) {
        Set<String> ids = new HashSet<>();
        if (descriptor.getNodes().isEmpty()) {
            issues.add(ValidationIssue.error("NO_NODES", null, "Graph declares no nodes"));
        }
        for (NodeDescriptor nd : descriptor.getNodes()) {
            if (nd == null || nd.getId() == null || nd.getId().isBlank()) {
                issues.add(ValidationIssue.error("MISSING_NODE_ID", null, "Node without id"));
                continue;
            }
            if (!ids.add(nd.getId())) {
                issues.add(ValidationIssue.error("DUPLICATE_NODE_ID", nd.getId(), "Node id declared more than once"));
            }
            if (nd.getType() == null || nd.getType().isBlank()) {
                issues.add(ValidationIssue.error("MISSING_NODE_TYPE", nd.getId(), "Node without type"));
            }
            if (nd.getCapability() != null) {
                try {
                    ExecutionCapability.parse(nd.getCapability());
                } catch (IllegalArgumentException e) {
                    issues.add(ValidationIssue.error("INVALID_CAPABILITY", nd.getId(),
                            "Unknown capability '" + nd.getCapability() + "'"));
                }
            }
        }
        for (NodeDescriptor nd : descriptor.getNodes()) {
            if (nd != null && nd.getJoin() != null && !ids.contains(nd.getJoin())) {
                issues.add(ValidationIssue.error("UNKNOWN_JOIN_NODE", nd.getId(),
                        "Join node '" + nd.getJoin() + "' does not exist"));
            }
        }
        return ids;
    }

    private static void checkEntryPoint(GraphDescriptor descriptor, Set<String> nodeIds, List<ValidationIssue> issues) {
        String entry = descriptor.getEntryPoint();
        if (entry == null || entry.isBlank()) {
            issues.add(ValidationIssue.error("MISSING_ENTRY_POINT", null, "No entry point declared"));
        } else if (!nodeIds.contains(entry)) {
            issues.add(ValidationIssue.error("UNKNOWN_ENTRY_POINT", entry, "Entry point is not a declared node"));
        }
    }

    private static void checkEdges(GraphDescriptor descriptor, Set<String> nodeIds, List<ValidationIssue> issues) {
        Set<String> endMarkers = descriptor.getNodes().stream()
                .filter(nd -> nd != null && Node.END_TYPE.equals(nd.getType()))
                .map(NodeDescriptor::getId)
                .collect(Collectors.toSet());
        for (EdgeDescriptor ed : descriptor.getEdges()) {
            String subject = ed.getFrom() + "->" + ed.getTo();
            if (!nodeIds.contains(ed.getFrom())) {
                issues.add(ValidationIssue.error("UNKNOWN_EDGE_SOURCE", subject,
                        "Edge source '" + ed.getFrom() + "' does not exist"));
            }
            if (!nodeIds.contains(ed.getTo())) {
                issues.add(ValidationIssue.error("UNKNOWN_EDGE_TARGET", subject,
                        "Edge target '" + ed.getTo() + "' does not exist"));
            }
            if (endMarkers.contains(ed.getFrom())) {
                issues.add(ValidationIssue.error("END_NODE_HAS_EDGES", subject,
                        "End node '" + ed.getFrom() + "' cannot have outgoing edges"));
            }
            GuardDescriptor guard = ed.getGuard();
            if (guard != null && (guard.getType() == null || guard.getType().isBlank())) {
                issues.add(ValidationIssue.error("MISSING_GUARD_TYPE", subject, "Guard without type"));
            }
        }
    }

    private Node buildNode(NodeDescriptor nd, List<ValidationIssue> issues) {
        if (Node.END_TYPE.equals(nd.getType())) {
            return new Node(nd.getId(), nd.getType(), null, nd.getConfig(), null, true, false, null,
                    nd.getDescription());
        }
        NodeFactory factory = registries.nodes().resolve(nd.getType());
        NodeImplementation impl = Objects.requireNonNull(
                factory.create(new NodeDefinition(nd.getId(), nd.getType(), nd.getConfig())),
                () -> "Node factory for type '" + nd.getType() + "' returned null");
        ExecutionCapability actual = Objects.requireNonNull(impl.capability(),
                () -> "Node implementation " + impl.getClass().getName() + " declares no capability");
        ExecutionCapability effective = narrow(nd, actual, issues);
        return new Node(nd.getId(), nd.getType(), effective, nd.getConfig(), impl, nd.isTerminal(),
                nd.isParallel(), nd.getJoin(), nd.getDescription());
    }

    private static ExecutionCapability narrow(NodeDescriptor nd, ExecutionCapability actual, List<ValidationIssue> issues) {
        ExecutionCapability declared = ExecutionCapability.parse(nd.getCapability());
        if (declared == null || declared == actual) return actual;
        boolean supported = (!declared.supportsSync() || actual.supportsSync())
                && (!declared.supportsAsync() || actual.supportsAsync());
        if (!supported) {
            issues.add(ValidationIssue.error("CAPABILITY_NOT_SUPPORTED", nd.getId(),
                    "Declared capability " + declared + " but implementation supports " + actual));
            return actual;
        }
        return declared;
    }

    private Edge buildEdge(int index, EdgeDescriptor ed) {
        GuardDescriptor gd = ed.getGuard();
        if (gd == null) {
            return new Edge(index, ed.getFrom(), ed.getTo(), null, null, ed.getDescription());
        }
        GuardFactory factory = registries.guards().resolve(gd.getType());
        GuardPredicate predicate = Objects.requireNonNull(factory.create(gd.getParams()),
                () -> "Guard factory for type '" + gd.getType() + "' returned null");
        return new Edge(index, ed.getFrom(), ed.getTo(), predicate, guardLabel(gd), ed.getDescription());
    }

    static String guardLabel(GuardDescriptor gd) {
        if (gd.getParams().isEmpty()) return gd.getType();
        String args = new TreeMap<>(gd.getParams()).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return gd.getType() + "(" + args + ")";
    }

    private static void throwIfErrors(String workflowId, List<ValidationIssue> issues) {
        List<ValidationIssue> errors = issues.stream().filter(ValidationIssue::isError).collect(Collectors.toList());
        if (!errors.isEmpty()) {
            throw new GraphValidationException(workflowId, errors);
        }
    }
}
