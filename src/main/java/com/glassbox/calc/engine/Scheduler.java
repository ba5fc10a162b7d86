package com.glassbox.calc.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.glassbox.calc.expr.Formula;
import com.glassbox.calc.expr.FormulaDependencies;
import com.glassbox.calc.expr.FormulaEvaluator;
import com.glassbox.calc.expr.FormulaSyntaxException;
import com.glassbox.calc.namespace.Ref;
import com.glassbox.calc.namespace.RefCategory;

import lombok.extern.log4j.Log4j2;

/**
 * Orders calculations for evaluation.
 *
 * Algorithm:
 *
 * 1. Parse every formula and split its calculation references into same-period
 * and lagged ones (read only inside SHIFT, PREVVAL or PREVSUM). Module output
 * references {@code M{n}.{k}} are mapped to their {@code R} id first.
 *
 * 2. Run Kahn's algorithm over the same-period edges. Nodes left unplaced sit
 * on or below a cycle; the strongly connected components among them are the
 * cycles. Cycle members are reported and excluded. Nodes merely downstream of
 * a cycle stay in the plan and read the cycle's zero arrays.
 *
 * 3. Add the lagged edges. Any strongly connected component of the combined
 * graph that is larger than one node, or a node lagging on itself, is a lag
 * cluster: it has no same-period cycle, so it can be evaluated period by
 * period with its members in same-period order.
 *
 * 4. Order the condensed graph (clusters as single units) with Kahn again.
 * External dependents of any member therefore follow the whole cluster.
 */
@Log4j2
public final class Scheduler {
    private final FormulaEvaluator evaluator;

    public Scheduler(FormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public EvaluationPlan plan(List<Calculation> calculations, Map<String, String> moduleRefs) {
        Map<Integer, Calculation> byId = new LinkedHashMap<>();
        for (Calculation c : calculations) {
            if (byId.put(c.id(), c) != null)
                throw new IllegalArgumentException("Duplicate calculation id: R" + c.id());
        }
        List<Integer> ids = new ArrayList<>(byId.keySet());

        Map<Integer, Formula> formulas = new HashMap<>();
        Map<Integer, FormulaSyntaxException> parseErrors = new HashMap<>();
        Map<Integer, List<Integer>> same = new HashMap<>();
        Map<Integer, List<Integer>> lagged = new HashMap<>();
        for (Calculation c : calculations) {
            try {
                Formula f = evaluator.parse(c.formula());
                formulas.put(c.id(), f);
                FormulaDependencies deps = f.dependencies();
                same.put(c.id(), calcIds(deps.samePeriod(), byId, moduleRefs));
                lagged.put(c.id(), calcIds(deps.lagged(), byId, moduleRefs));
            } catch (FormulaSyntaxException e) {
                parseErrors.put(c.id(), e);
                same.put(c.id(), List.of());
                lagged.put(c.id(), List.of());
            }
        }

        List<List<Integer>> cycles = findCycles(ids, same);
        Set<Integer> cyclic = new HashSet<>();
        for (List<Integer> cycle : cycles) {
            cyclic.addAll(cycle);
            log.warn("Circular dependency detected: {}", refs(cycle));
        }

        List<EvaluationUnit> units = orderUnits(ids, cyclic, same, lagged);
        log.debug("Scheduled {} calculations in {} units ({} lag clusters, {} cyclic)", ids.size(),
                units.size(), units.stream().filter(EvaluationUnit::cluster).count(), cyclic.size());
        return new EvaluationPlan(byId, formulas, parseErrors, same, lagged, units, cycles);
    }

    private static List<Integer> calcIds(List<Ref> refs, Map<Integer, Calculation> byId,
            Map<String, String> moduleRefs) {
        Set<Integer> out = new LinkedHashSet<>();
        for (Ref r : refs) {
            Ref target = r;
            if (r.category() == RefCategory.MODULE_OUTPUT) {
                String mapped = moduleRefs == null ? null : moduleRefs.get(r.key());
                target = mapped == null ? null : Ref.parse(mapped);
            }
            if (target != null && target.category() == RefCategory.CALCULATION
                    && byId.containsKey(target.calculationId()))
                out.add(target.calculationId());
        }
        return new ArrayList<>(out);
    }

    /** Same-period cycles, members in input order, cycles ordered by first member. */
    private static List<List<Integer>> findCycles(List<Integer> ids, Map<Integer, List<Integer>> same) {
        TopologicalOrder.Builder b = TopologicalOrder.builder();
        for (int id : ids)
            b.addNode(id);
        for (int id : ids)
            for (int dep : same.get(id))
                b.addEdge(dep, id);
        TopologicalOrder first = b.build();
        if (first.isComplete())
            return List.of();

        int[] unresolved = first.unresolved();
        Map<Integer, Integer> local = new HashMap<>();
        for (int i = 0; i < unresolved.length; i++)
            local.put(unresolved[i], i);
        List<int[]> adjacency = new ArrayList<>();
        for (int id : unresolved)
            adjacency.add(new int[0]);
        for (int id : unresolved) {
            for (int dep : same.get(id)) {
                Integer d = local.get(dep);
                if (d != null)
                    adjacency.set(d, append(adjacency.get(d), local.get(id)));
            }
        }

        List<List<Integer>> cycles = new ArrayList<>();
        for (int[] comp : StronglyConnected.components(adjacency)) {
            int first0 = unresolved[comp[0]];
            if (comp.length > 1 || same.get(first0).contains(first0)) {
                List<Integer> members = new ArrayList<>();
                for (int m : comp)
                    members.add(unresolved[m]);
                cycles.add(members);
            }
        }
        Map<Integer, Integer> position = positions(ids);
        cycles.sort(Comparator.comparingInt(c -> position.get(c.get(0))));
        return cycles;
    }

    private static List<EvaluationUnit> orderUnits(List<Integer> ids, Set<Integer> cyclic,
            Map<Integer, List<Integer>> same, Map<Integer, List<Integer>> lagged) {
        List<Integer> live = new ArrayList<>();
        for (int id : ids) {
            if (!cyclic.contains(id))
                live.add(id);
        }
        Map<Integer, Integer> local = positions(live);

        List<int[]> adjacency = new ArrayList<>();
        for (int i = 0; i < live.size(); i++)
            adjacency.add(new int[0]);
        boolean[] selfLag = new boolean[live.size()];
        for (int id : live) {
            int to = local.get(id);
            for (int dep : same.get(id)) {
                Integer from = local.get(dep);
                if (from != null)
                    adjacency.set(from, append(adjacency.get(from), to));
            }
            for (int dep : lagged.get(id)) {
                Integer from = local.get(dep);
                if (from == null)
                    continue;
                if (from == to)
                    selfLag[to] = true;
                else
                    adjacency.set(from, append(adjacency.get(from), to));
            }
        }

        List<int[]> comps = StronglyConnected.components(adjacency);
        comps.sort(Comparator.comparingInt(c -> c[0]));
        int[] unitOf = new int[live.size()];
        List<EvaluationUnit> candidates = new ArrayList<>();
        for (int u = 0; u < comps.size(); u++) {
            int[] comp = comps.get(u);
            for (int m : comp)
                unitOf[m] = u;
            if (comp.length == 1 && !selfLag[comp[0]]) {
                candidates.add(EvaluationUnit.single(live.get(comp[0])));
            } else {
                candidates.add(EvaluationUnit.cluster(clusterOrder(comp, live, same)));
            }
        }

        TopologicalOrder.Builder b = TopologicalOrder.builder();
        for (int u = 0; u < candidates.size(); u++)
            b.addNode(u);
        for (int from = 0; from < adjacency.size(); from++) {
            for (int to : adjacency.get(from)) {
                if (unitOf[from] != unitOf[to])
                    b.addEdge(unitOf[from], unitOf[to]);
            }
        }
        TopologicalOrder condensed = b.build();
        if (!condensed.isComplete())
            throw new IllegalStateException("Condensed dependency graph is not acyclic");

        List<EvaluationUnit> units = new ArrayList<>();
        for (int u : condensed.order())
            units.add(candidates.get(u));
        return units;
    }

    /** Members of a lag cluster in same-period order, ties in input order. */
    private static List<Integer> clusterOrder(int[] comp, List<Integer> live, Map<Integer, List<Integer>> same) {
        TopologicalOrder.Builder b = TopologicalOrder.builder();
        Set<Integer> members = new LinkedHashSet<>();
        for (int m : comp) {
            b.addNode(live.get(m));
            members.add(live.get(m));
        }
        for (int id : members) {
            for (int dep : same.get(id)) {
                if (members.contains(dep))
                    b.addEdge(dep, id);
            }
        }
        TopologicalOrder order = b.build();
        List<Integer> out = Arrays.stream(order.order()).boxed().collect(Collectors.toList());
        for (int id : order.unresolved())
            out.add(id);
        return out;
    }

    private static Map<Integer, Integer> positions(List<Integer> ids) {
        Map<Integer, Integer> pos = new HashMap<>();
        for (int i = 0; i < ids.size(); i++)
            pos.put(ids.get(i), i);
        return pos;
    }

    private static int[] append(int[] arr, int v) {
        for (int x : arr) {
            if (x == v)
                return arr;
        }
        int[] next = Arrays.copyOf(arr, arr.length + 1);
        next[arr.length] = v;
        return next;
    }

    static String refs(List<Integer> ids) {
        return ids.stream().map(id -> "R" + id).collect(Collectors.joining(", "));
    }
}
