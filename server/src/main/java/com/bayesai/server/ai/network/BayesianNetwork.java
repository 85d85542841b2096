package com.bayesai.server.ai.network;

import com.bayesai.server.ai.exception.StructuralException;
import com.bayesai.server.ai.exception.UnknownNodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Directed acyclic graph of {@link NetworkNode}s.
 * <p>
 * Nodes live in a contiguous store indexed by integer id, with a name to id map and
 * parent/child id lists per node. Every mutation is validated completely before anything is
 * changed, so the graph is acyclic and every parent resolves between any two calls.
 * <p>
 * Derived state such as the topological order is recomputed inside each mutation, so read
 * methods write nothing and may run concurrently. Mutations are not thread-safe: callers
 * sharing an instance guard it with a single-writer, multiple-reader lock (see
 * {@code BayesNetworkService}).
 */
public class BayesianNetwork {

    private static final Logger logger = LoggerFactory.getLogger(BayesianNetwork.class);

    private final List<NetworkNode> nodes = new ArrayList<>();
    private final Map<String, Integer> idByName = new HashMap<>();
    private final List<int[]> parentIds = new ArrayList<>();
    private final List<List<Integer>> childIds = new ArrayList<>();

    // recomputed by every mutation; queries only read it
    private int[] topologicalIds = new int[0];

    public BayesianNetwork() {
    }

    public BayesianNetwork(List<NetworkNode> initialNodes) {
        for (NetworkNode node : initialNodes) {
            addNode(node);
        }
    }

    /**
     * Adds a node whose parents are all already present.
     *
     * @throws StructuralException if the name is taken, a parent is missing or has a
     *                             different domain than the node's table assumes, or the
     *                             insertion would close a cycle
     */
    public void addNode(NetworkNode node) {
        String name = node.getName();
        if (idByName.containsKey(name)) {
            throw new StructuralException(name, "Node " + name + " already exists in the network");
        }

        int[] parents = new int[node.getParents().size()];
        for (int i = 0; i < parents.length; i++) {
            RandomVariable declared = node.getParents().get(i);
            String parentName = declared.getName();
            if (parentName.equals(name)) {
                throw new StructuralException(name, name + " cannot be added since it lists itself as parent");
            }
            Integer parentId = idByName.get(parentName);
            if (parentId == null) {
                throw new StructuralException(parentName, "No predecessor " + parentName
                        + " exists in network for node " + name);
            }
            RandomVariable actual = nodes.get(parentId).getVariable();
            if (!actual.equals(declared)) {
                throw new StructuralException(parentName, "Node " + name + " expects parent " + declared
                        + " but network holds " + actual);
            }
            parents[i] = parentId;
        }

        if (reachesName(parents, name)) {
            throw new StructuralException(name, name + " cannot be added since acyclic condition does not hold");
        }

        int id = nodes.size();
        nodes.add(node);
        idByName.put(name, id);
        parentIds.add(parents);
        childIds.add(new ArrayList<>());
        for (int p : parents) {
            childIds.get(p).add(id);
        }
        topologicalIds = computeTopologicalIds();
        logger.debug("{} is added with parents {}", name, node.getParentNames());
    }

    // Walks upward from the given parents; true if a node named `name` is met.
    private boolean reachesName(int[] start, String name) {
        Deque<Integer> queue = new ArrayDeque<>();
        Set<Integer> seen = new HashSet<>();
        for (int s : start) {
            queue.add(s);
        }
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (!seen.add(current)) {
                continue;
            }
            if (nodes.get(current).getName().equals(name)) {
                return true;
            }
            for (int p : parentIds.get(current)) {
                queue.add(p);
            }
        }
        return false;
    }

    /**
     * Removes a node that no other node lists as a parent; otherwise the call is rejected.
     *
     * @return the removed node names
     */
    public List<String> removeNode(String name) {
        return removeNode(name, RemovalPolicy.REJECT);
    }

    /**
     * Removes a node. With {@link RemovalPolicy#CASCADE} every descendant is removed as well,
     * in one step.
     *
     * @return the removed node names, children before parents
     */
    public List<String> removeNode(String name, RemovalPolicy policy) {
        int id = requireId(name);
        List<Integer> children = childIds.get(id);
        if (!children.isEmpty() && policy != RemovalPolicy.CASCADE) {
            List<String> dependents = namesOf(children);
            throw new StructuralException(name, "Node " + name + " cannot be removed, it is a parent of "
                    + dependents);
        }

        Set<Integer> doomed = new HashSet<>();
        doomed.add(id);
        doomed.addAll(collect(id, false));

        List<String> removed = new ArrayList<>();
        int[] order = topologicalIds();
        for (int i = order.length - 1; i >= 0; i--) {
            if (doomed.contains(order[i])) {
                removed.add(nodes.get(order[i]).getName());
            }
        }

        rebuildWithout(doomed);
        logger.debug("Removed {} from the network", removed);
        return removed;
    }

    private void rebuildWithout(Set<Integer> doomed) {
        List<NetworkNode> kept = new ArrayList<>(nodes.size() - doomed.size());
        for (int i = 0; i < nodes.size(); i++) {
            if (!doomed.contains(i)) {
                kept.add(nodes.get(i));
            }
        }
        nodes.clear();
        idByName.clear();
        parentIds.clear();
        childIds.clear();
        topologicalIds = new int[0];
        // Insertion order is preserved, so every parent is re-added before its children.
        for (NetworkNode node : kept) {
            addNode(node);
        }
    }

    /**
     * Deterministic topological order, ties broken by node name.
     */
    public List<String> topologicalOrder() {
        int[] order = topologicalIds();
        List<String> names = new ArrayList<>(order.length);
        for (int id : order) {
            names.add(nodes.get(id).getName());
        }
        return names;
    }

    /**
     * Node ids in topological order. The returned array must not be modified.
     */
    public int[] topologicalIds() {
        return topologicalIds;
    }

    private int[] computeTopologicalIds() {
        int n = nodes.size();
        int[] inDegree = new int[n];
        PriorityQueue<Integer> ready = new PriorityQueue<>(
                (a, b) -> nodes.get(a).getName().compareTo(nodes.get(b).getName()));
        for (int i = 0; i < n; i++) {
            inDegree[i] = parentIds.get(i).length;
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        int[] order = new int[n];
        int k = 0;
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order[k++] = current;
            for (int child : childIds.get(current)) {
                if (--inDegree[child] == 0) {
                    ready.add(child);
                }
            }
        }
        if (k != n) {
            // unreachable while add/remove keep the graph acyclic
            throw new IllegalStateException("Network graph contains a cycle");
        }
        return order;
    }

    public List<String> parents(String name) {
        return nodes.get(requireId(name)).getParentNames();
    }

    public List<String> children(String name) {
        return namesOf(childIds.get(requireId(name)));
    }

    public Set<String> ancestors(String name) {
        return sortedNames(collect(requireId(name), true));
    }

    public Set<String> descendants(String name) {
        return sortedNames(collect(requireId(name), false));
    }

    // Breadth-first closure over parent (upward) or child edges, excluding the start node.
    private Set<Integer> collect(int start, boolean upward) {
        Set<Integer> found = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (upward) {
                for (int p : parentIds.get(current)) {
                    if (found.add(p)) {
                        queue.add(p);
                    }
                }
            } else {
                for (int c : childIds.get(current)) {
                    if (found.add(c)) {
                        queue.add(c);
                    }
                }
            }
        }
        return found;
    }

    private Set<String> sortedNames(Set<Integer> ids) {
        Set<String> names = new TreeSet<>();
        for (int id : ids) {
            names.add(nodes.get(id).getName());
        }
        return Collections.unmodifiableSet(names);
    }

    private List<String> namesOf(List<Integer> ids) {
        List<String> names = new ArrayList<>(ids.size());
        for (int id : ids) {
            names.add(nodes.get(id).getName());
        }
        return Collections.unmodifiableList(names);
    }

    private int requireId(String name) {
        Integer id = idByName.get(name);
        if (id == null) {
            throw new UnknownNodeException(name);
        }
        return id;
    }

    public boolean contains(String name) {
        return idByName.containsKey(name);
    }

    public int size() {
        return nodes.size();
    }

    public NetworkNode getNode(String name) {
        return nodes.get(requireId(name));
    }

    /**
     * @return the node id, or -1 if no such node exists
     */
    public int idOf(String name) {
        Integer id = idByName.get(name);
        return id != null ? id : -1;
    }

    public NetworkNode nodeAt(int id) {
        return nodes.get(id);
    }

    /**
     * Parent ids of a node in the node's parent declaration order. Must not be modified.
     */
    public int[] parentIdsOf(int id) {
        return parentIds.get(id);
    }

    public List<String> getNodeNames() {
        List<String> names = new ArrayList<>(nodes.size());
        for (NetworkNode node : nodes) {
            names.add(node.getName());
        }
        return names;
    }

    /**
     * Every directed edge as a {@code parent -> child} string, in id order.
     */
    public List<String> edges() {
        List<String> edges = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            for (int p : parentIds.get(i)) {
                edges.add(nodes.get(p).getName() + "->" + nodes.get(i).getName());
            }
        }
        return edges;
    }

    /**
     * Independent deep copy of the graph and every node's table.
     */
    public BayesianNetwork copy() {
        BayesianNetwork clone = new BayesianNetwork();
        for (NetworkNode node : nodes) {
            clone.addNode(node.copy());
        }
        return clone;
    }
}
