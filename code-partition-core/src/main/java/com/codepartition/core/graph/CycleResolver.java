package com.codepartition.core.graph;

import com.codepartition.core.model.CondensedGraph;
import com.codepartition.core.model.DependencyGraph;
import com.codepartition.core.model.Entity;
import com.codepartition.core.model.EntityGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Condenses the strongly connected components of a dependency graph into groups.
 *
 * <p>Uses Tarjan's algorithm with an explicit stack, so deep dependency chains cannot
 * overflow the call stack. Every entity ends up in exactly one group; a group of size
 * one is an ordinary entity. The condensation of strongly connected components is acyclic.
 *
 * <p>Group ids {@code g0..gN} follow the order of each group's anchor, its first member
 * in graph order (file path, then declaration order). Members and condensed edges are
 * sorted the same way, so identical graphs yield identical condensations.
 */
public class CycleResolver {

    private static final Logger log = LoggerFactory.getLogger(CycleResolver.class);

    private static final int UNVISITED = -1;

    /**
     * Condenses the graph.
     *
     * @param graph dependency graph
     * @return condensed graph with one node per strongly connected component
     */
    public CondensedGraph condense(DependencyGraph graph) {
        List<String> ids = new ArrayList<>(graph.entities().keySet());
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            position.put(ids.get(i), i);
        }
        int[][] adjacency = adjacency(graph, ids, position);
        int[] component = stronglyConnectedComponents(adjacency);

        // Members per component, in graph order; anchors are the first members.
        Map<Integer, List<Integer>> members = new LinkedHashMap<>();
        for (int node = 0; node < ids.size(); node++) {
            members.computeIfAbsent(component[node], c -> new ArrayList<>()).add(node);
        }

        List<EntityGroup> groups = new ArrayList<>();
        Map<Integer, String> groupIdOfComponent = new HashMap<>();
        Map<String, String> groupOfEntity = new LinkedHashMap<>();
        for (List<Integer> nodes : members.values()) {
            String groupId = "g" + groups.size();
            groupIdOfComponent.put(component[nodes.get(0)], groupId);
            List<String> memberIds = new ArrayList<>();
            long tokens = 0;
            for (int node : nodes) {
                Entity entity = graph.entity(ids.get(node));
                memberIds.add(entity.id());
                tokens += entity.tokenCount();
                groupOfEntity.put(entity.id(), groupId);
            }
            Entity anchor = graph.entity(memberIds.get(0));
            groups.add(new EntityGroup(groupId, memberIds, tokens, anchor.filePath(), anchor.ordinal()));
        }

        Map<String, Integer> groupIndex = new HashMap<>();
        for (int i = 0; i < groups.size(); i++) {
            groupIndex.put(groups.get(i).id(), i);
        }
        Comparator<String> byIndex = Comparator.comparing(groupIndex::get);
        Map<String, TreeSet<String>> edges = new LinkedHashMap<>();
        groups.forEach(group -> edges.put(group.id(), new TreeSet<>(byIndex)));
        for (int from = 0; from < adjacency.length; from++) {
            String fromGroup = groupIdOfComponent.get(component[from]);
            for (int to : adjacency[from]) {
                String toGroup = groupIdOfComponent.get(component[to]);
                if (!fromGroup.equals(toGroup)) {
                    edges.get(fromGroup).add(toGroup);
                }
            }
        }
        Map<String, List<String>> successors = new LinkedHashMap<>();
        edges.forEach((groupId, targets) -> successors.put(groupId, new ArrayList<>(targets)));

        CondensedGraph condensed = new CondensedGraph(groups, groupOfEntity, successors);
        log.info("Condensed {} entities into {} groups ({} cyclic)",
            ids.size(), groups.size(), condensed.cyclicGroupCount());
        return condensed;
    }

    private static int[][] adjacency(DependencyGraph graph, List<String> ids, Map<String, Integer> position) {
        Map<String, List<String>> successors = graph.successors();
        int[][] adjacency = new int[ids.size()][];
        for (int node = 0; node < ids.size(); node++) {
            adjacency[node] = successors.get(ids.get(node)).stream()
                .mapToInt(position::get)
                .sorted()
                .toArray();
        }
        return adjacency;
    }

    /**
     * Iterative Tarjan. Returns the component number of every node.
     */
    private static int[] stronglyConnectedComponents(int[][] adjacency) {
        int n = adjacency.length;
        int[] index = new int[n];
        int[] lowLink = new int[n];
        int[] component = new int[n];
        int[] nextEdge = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, UNVISITED);
        Deque<Integer> stack = new ArrayDeque<>();
        Deque<Integer> callStack = new ArrayDeque<>();
        int counter = 0;
        int components = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != UNVISITED) {
                continue;
            }
            callStack.push(root);
            index[root] = lowLink[root] = counter++;
            stack.push(root);
            onStack[root] = true;

            while (!callStack.isEmpty()) {
                int node = callStack.peek();
                if (nextEdge[node] < adjacency[node].length) {
                    int next = adjacency[node][nextEdge[node]++];
                    if (index[next] == UNVISITED) {
                        index[next] = lowLink[next] = counter++;
                        stack.push(next);
                        onStack[next] = true;
                        callStack.push(next);
                    } else if (onStack[next]) {
                        lowLink[node] = Math.min(lowLink[node], index[next]);
                    }
                    continue;
                }
                callStack.pop();
                if (lowLink[node] == index[node]) {
                    int member;
                    do {
                        member = stack.pop();
                        onStack[member] = false;
                        component[member] = components;
                    } while (member != node);
                    components++;
                }
                if (!callStack.isEmpty()) {
                    int parent = callStack.peek();
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[node]);
                }
            }
        }
        return component;
    }
}
