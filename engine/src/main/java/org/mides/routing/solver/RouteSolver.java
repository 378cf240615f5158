package org.mides.routing.solver;

import org.mides.routing.config.EngineConfig;
import org.mides.routing.model.Delivery;
import org.mides.routing.model.OptimizeBy;
import org.mides.routing.model.Priority;
import org.mides.routing.model.RouteRequest;
import org.mides.routing.model.SkipReason;
import org.mides.routing.model.SkippedDelivery;
import org.mides.routing.util.GeoMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Single-vehicle routing with time windows and priority tiers.
 * <p>
 * The route is built in two phases. Construction starts at the depot when it opens and
 * repeatedly appends the admissible delivery with the best step score of the requested
 * {@link OptimizeBy}; deliveries that cannot follow the current end are deferred, not
 * dropped. Improvement then runs a bounded best-improvement local search over insert,
 * replace, relocate and swap moves, minimizing travel cost plus the skip penalties of the
 * deliveries left out. A move is taken only if the whole new order stays feasible and no
 * routed HIGH delivery is lost. Priority routes keep their construction order and only
 * gain coverage. A priority solve also runs the reordering search and switches to its route
 * when that route reaches a HIGH delivery the priority order leaves out.
 * <p>
 * Instances hold no per-solve state and may be shared between threads.
 */
public class RouteSolver {

    private static final Logger logger = LoggerFactory.getLogger(RouteSolver.class);

    private static final double EPSILON = FeasibilityChecker.EPSILON;
    private static final Comparator<Delivery> REQUEST_ORDER = Comparator.comparingInt(Delivery::getIndex);

    private final EngineConfig config;
    private final PriorityModel priorityModel;

    public RouteSolver(EngineConfig config) {
        this.config = config;
        this.priorityModel = new PriorityModel(config);
    }

    /**
     * Solves an initialized request.
     */
    public SolvedRoute solve(RouteRequest request) {
        var context = RouteContext.from(request);
        var checker = new FeasibilityChecker(config, context);
        var optimizeBy = context.getOptimizeBy();

        var plan = search(request.getDeliveries(), checker, optimizeBy);
        if (!optimizeBy.allowsReordering()) {
            var reordered = search(request.getDeliveries(), checker, OptimizeBy.DISTANCE);
            if (!routedHigh(plan).containsAll(routedHigh(reordered))) {
                logger.debug("Reordered route reaches high priority deliveries the priority order misses, using it");
                plan = reordered;
            }
        }

        var skipped = classifySkipped(plan, checker);
        var evaluation = plan.evaluation;
        boolean allHighRouted = skipped.stream().noneMatch(s -> s.getPriority() == Priority.HIGH);
        boolean returnOnTime = evaluation.getReturnLeg() == null || evaluation.getReturnLeg().isOnTime();

        if (!returnOnTime)
            logger.warn("Return to depot at minute {} is after closing minute {}",
                evaluation.getReturnLeg().getArrivalMinutes(), context.getEndMinutes());

        logTightArrivals(evaluation);
        return new SolvedRoute(evaluation, Collections.unmodifiableList(skipped), allHighRouted && returnOnTime);
    }

    private Plan search(List<Delivery> deliveries, FeasibilityChecker checker, OptimizeBy optimizeBy) {
        var order = construct(deliveries, checker, optimizeBy);
        var unrouted = notIn(deliveries, order);
        logger.debug("Construction by {} routed {} of {} deliveries", optimizeBy, order.size(), deliveries.size());

        var constructed = RouteEvaluation.of(order, checker);
        var initial = new Plan(order, unrouted, constructed, objective(constructed, unrouted, optimizeBy));
        return improve(initial, checker, optimizeBy);
    }

    List<Delivery> construct(List<Delivery> deliveries, FeasibilityChecker checker, OptimizeBy optimizeBy) {
        var remaining = new ArrayList<>(deliveries);
        var order = new ArrayList<Delivery>();
        var state = checker.initialState();

        while (!remaining.isEmpty()) {
            FeasibilityResult best = null;
            double bestScore = 0.0;
            int bestAt = -1;

            for (int i = 0; i < remaining.size(); i++) {
                var result = checker.check(state, remaining.get(i));
                if (!result.isAdmitted())
                    continue;

                double score = optimizeBy.score(result.getLegDistanceKm(), result.getLegMinutes(),
                    priorityModel.weight(result.getDelivery().getPriority()));
                if (best == null || outranks(score, result, bestScore, best)) {
                    best = result;
                    bestScore = score;
                    bestAt = i;
                }
            }

            if (best == null)
                break;

            logger.debug("Appending {} after a {} km leg, arriving at minute {}",
                best.getDelivery(), best.getLegDistanceKm(), best.getArrivalMinutes());
            order.add(best.getDelivery());
            remaining.remove(bestAt);
            state = best.getNext();
        }

        return order;
    }

    /* Score first, then the shorter leg, then the more urgent window; remaining ties keep request order */
    private static boolean outranks(double score, FeasibilityResult candidate, double bestScore, FeasibilityResult best) {
        if (score > bestScore + EPSILON)
            return true;
        if (score < bestScore - EPSILON)
            return false;

        if (candidate.getLegDistanceKm() < best.getLegDistanceKm() - EPSILON)
            return true;
        if (candidate.getLegDistanceKm() > best.getLegDistanceKm() + EPSILON)
            return false;

        return candidate.getDelivery().getTimeWindow().getEnd()
            .compareTo(best.getDelivery().getTimeWindow().getEnd()) < 0;
    }

    private Plan improve(Plan initial, FeasibilityChecker checker, OptimizeBy optimizeBy) {
        var current = initial;
        int limit = config.getImprovementIterationLimit();

        int iteration = 0;
        while (iteration < limit) {
            Plan best = bestInsertion(current, checker, optimizeBy);
            best = pick(best, bestReplacement(current, checker, optimizeBy));
            if (optimizeBy.allowsReordering()) {
                best = pick(best, bestRelocation(current, checker, optimizeBy));
                best = pick(best, bestSwap(current, checker, optimizeBy));
            }

            if (best == null)
                break;

            logger.debug("Improvement {}: objective {} -> {}, routed {} -> {}",
                iteration, current.objective, best.objective, current.order.size(), best.order.size());
            current = best;
            iteration++;
        }

        if (iteration == limit)
            logger.debug("Improvement stopped at the iteration limit of {}", limit);

        return current;
    }

    private Plan bestInsertion(Plan current, FeasibilityChecker checker, OptimizeBy optimizeBy) {
        Plan best = null;
        for (Delivery candidate : current.unrouted) {
            var rest = without(current.unrouted, candidate);
            for (int position = 0; position <= current.order.size(); position++) {
                if (cannotInsert(current, candidate, position, checker.context()))
                    continue;
                best = consider(best, current, inserted(current.order, position, candidate), rest, checker, optimizeBy);
            }
        }
        return best;
    }

    private Plan bestReplacement(Plan current, FeasibilityChecker checker, OptimizeBy optimizeBy) {
        Plan best = null;
        for (Delivery candidate : current.unrouted) {
            for (int position = 0; position < current.order.size(); position++) {
                var order = new ArrayList<>(current.order);
                var removed = order.set(position, candidate);

                var unrouted = without(current.unrouted, candidate);
                unrouted.add(removed);
                unrouted.sort(REQUEST_ORDER);

                best = consider(best, current, order, unrouted, checker, optimizeBy);
            }
        }
        return best;
    }

    private Plan bestRelocation(Plan current, FeasibilityChecker checker, OptimizeBy optimizeBy) {
        Plan best = null;
        int size = current.order.size();
        for (int from = 0; from < size; from++) {
            for (int to = 0; to < size; to++) {
                if (to == from)
                    continue;
                var order = new ArrayList<>(current.order);
                order.add(to, order.remove(from));
                best = consider(best, current, order, current.unrouted, checker, optimizeBy);
            }
        }
        return best;
    }

    private Plan bestSwap(Plan current, FeasibilityChecker checker, OptimizeBy optimizeBy) {
        Plan best = null;
        int size = current.order.size();
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                var order = new ArrayList<>(current.order);
                Collections.swap(order, i, j);
                best = consider(best, current, order, current.unrouted, checker, optimizeBy);
            }
        }
        return best;
    }

    /**
     * Lower-bound test for inserting {@code candidate} before {@code position}.
     * The detour {@code d(prev, c) + d(c, next) - d(prev, next)} is non-negative by the
     * triangle inequality and is exactly the extra distance at every later stop; the
     * departure from {@code prev} does not move, so a late direct arrival is final.
     */
    private boolean cannotInsert(Plan current, Delivery candidate, int position, RouteContext context) {
        var previous = position == 0 ? context.getDepot() : current.order.get(position - 1).location();
        double toCandidate = GeoMetrics.distanceKm(previous, candidate.location());

        double detour = toCandidate;
        if (position < current.order.size()) {
            var following = current.order.get(position).location();
            detour += GeoMetrics.distanceKm(candidate.location(), following) - GeoMetrics.distanceKm(previous, following);
        }
        if (current.evaluation.deliveryDistanceKm() + detour > config.getMaxRouteDistanceKm() + EPSILON)
            return true;

        double earliest = current.evaluation.departureAfter(position)
            + GeoMetrics.travelMinutes(toCandidate, context.getSpeedKmh());
        return earliest > candidate.getTimeWindow().endMinutes() + EPSILON;
    }

    private Plan consider(Plan best, Plan current, List<Delivery> order, List<Delivery> unrouted,
                          FeasibilityChecker checker, OptimizeBy optimizeBy) {
        if (countHigh(order) < countHigh(current.order))
            return best;

        var evaluation = RouteEvaluation.of(order, checker);
        if (!evaluation.isFeasible())
            return best;

        double objective = objective(evaluation, unrouted, optimizeBy);
        if (objective >= current.objective - EPSILON)
            return best;
        if (best != null && objective >= best.objective - EPSILON)
            return best;

        return new Plan(order, unrouted, evaluation, objective);
    }

    private double objective(RouteEvaluation evaluation, List<Delivery> unrouted, OptimizeBy optimizeBy) {
        double penalties = 0.0;
        for (Delivery delivery : unrouted) {
            penalties += priorityModel.penalty(delivery.getPriority());
        }
        return evaluation.travelCost(optimizeBy) + penalties;
    }

    private List<SkippedDelivery> classifySkipped(Plan plan, FeasibilityChecker checker) {
        var skipped = new ArrayList<SkippedDelivery>();
        for (Delivery delivery : plan.unrouted) {
            var reason = leastViolatingReason(plan.order, delivery, checker);
            if (delivery.getPriority() == Priority.HIGH)
                logger.warn("High priority delivery {} skipped: {}", delivery, reason);
            else
                logger.debug("Delivery {} skipped: {}", delivery, reason);
            skipped.add(SkippedDelivery.of(delivery, reason));
        }
        return skipped;
    }

    /**
     * Tries the delivery at every position of the final order. The reported reason is the
     * violation furthest along the check order; on a tie an attempt where the delivery itself
     * was admitted wins, then the earliest position.
     */
    private SkipReason leastViolatingReason(List<Delivery> order, Delivery delivery, FeasibilityChecker checker) {
        SkipReason best = null;
        boolean bestSelfAdmitted = false;

        for (int position = 0; position <= order.size(); position++) {
            var evaluation = RouteEvaluation.of(inserted(order, position, delivery), checker);
            if (evaluation.isFeasible())
                return SkipReason.NOT_BENEFICIAL;

            var reason = evaluation.getFailure();
            boolean selfAdmitted = evaluation.getFailedIndex() != position;
            if (best == null
                || reason.ordinal() > best.ordinal()
                || (reason == best && selfAdmitted && !bestSelfAdmitted)) {
                best = reason;
                bestSelfAdmitted = selfAdmitted;
            }
        }
        return best;
    }

    private void logTightArrivals(RouteEvaluation evaluation) {
        if (!logger.isDebugEnabled())
            return;

        for (var visit : evaluation.getVisits()) {
            double slack = visit.getDelivery().getTimeWindow().endMinutes() - visit.getArrivalMinutes();
            if (slack < config.getBufferTimeMinutes())
                logger.debug("Tight arrival at {}: {} minutes before the window closes",
                    visit.getDelivery(), String.format("%.1f", slack));
        }
    }

    private static Set<Delivery> routedHigh(Plan plan) {
        var result = Collections.newSetFromMap(new IdentityHashMap<Delivery, Boolean>());
        for (Delivery delivery : plan.order) {
            if (delivery.getPriority() == Priority.HIGH)
                result.add(delivery);
        }
        return result;
    }

    private static int countHigh(List<Delivery> deliveries) {
        int count = 0;
        for (Delivery delivery : deliveries) {
            if (delivery.getPriority() == Priority.HIGH)
                count++;
        }
        return count;
    }

    private static List<Delivery> inserted(List<Delivery> order, int position, Delivery delivery) {
        var result = new ArrayList<Delivery>(order.size() + 1);
        result.addAll(order);
        result.add(position, delivery);
        return result;
    }

    private static List<Delivery> without(List<Delivery> deliveries, Delivery removed) {
        var result = new ArrayList<Delivery>(deliveries.size());
        for (Delivery delivery : deliveries) {
            if (delivery != removed)
                result.add(delivery);
        }
        return result;
    }

    private static List<Delivery> notIn(List<Delivery> deliveries, List<Delivery> routed) {
        var routedSet = Collections.newSetFromMap(new IdentityHashMap<Delivery, Boolean>());
        routedSet.addAll(routed);

        var result = new ArrayList<Delivery>();
        for (Delivery delivery : deliveries) {
            if (!routedSet.contains(delivery))
                result.add(delivery);
        }
        return result;
    }

    private static Plan pick(Plan best, Plan challenger) {
        if (challenger == null)
            return best;
        if (best == null || challenger.objective < best.objective - EPSILON)
            return challenger;
        return best;
    }

    private static final class Plan {
        private final List<Delivery> order;
        private final List<Delivery> unrouted;
        private final RouteEvaluation evaluation;
        private final double objective;

        private Plan(List<Delivery> order, List<Delivery> unrouted, RouteEvaluation evaluation, double objective) {
            this.order = order;
            this.unrouted = unrouted;
            this.evaluation = evaluation;
            this.objective = objective;
        }
    }
}
