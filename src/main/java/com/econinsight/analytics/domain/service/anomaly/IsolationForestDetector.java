package com.econinsight.analytics.domain.service.anomaly;

import com.econinsight.analytics.domain.exception.InsufficientHistoryException;
import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.Observation;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;
import java.util.stream.IntStream;

/**
 * Isolation-forest scorer. Observations that random axis-aligned splits isolate quickly score close to 1;
 * the top {@code round(contamination * N)} scores are flagged. Fully deterministic for a fixed seed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IsolationForestDetector {

    private static final double EULER_GAMMA = 0.5772156649;

    private final AnalyticsProperties properties;

    public List<AnomalyFlag> detect(Series series) {
        return detect(series, properties.getAnomaly().getContamination());
    }

    public List<AnomalyFlag> detect(Series series, double contamination) {
        AnalyticsProperties.Anomaly config = properties.getAnomaly();
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (series.size() < config.getMinPoints()) {
            throw new InsufficientHistoryException(series.getId(), series.size(), config.getMinPoints());
        }

        double[][] features = new AnomalyFeatureExtractor(config.getRollingWindow()).extract(series);
        double[] scores = score(features, config.getTreeCount(), config.getSampleSize(), config.getSeed());

        int n = scores.length;
        int flagged = (int) Math.round(contamination * n);
        boolean[] outlier = new boolean[n];
        IntStream.range(0, n).boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(flagged)
                .forEach(i -> outlier[i] = true);

        List<AnomalyFlag> flags = new ArrayList<>(n);
        List<Observation> observations = series.getObservations();
        for (int i = 0; i < n; i++) {
            Observation o = observations.get(i);
            flags.add(new AnomalyFlag(series.getId(), o.date(), o.value(), scores[i], outlier[i]));
        }

        log.debug("[Anomaly] 점수 산출 완료: series={}, n={}, flagged={}, contamination={}",
                series.getId(), n, flagged, contamination);
        return flags;
    }

    static double[] score(double[][] data, int treeCount, int sampleSize, long seed) {
        int n = data.length;
        int psi = Math.min(sampleSize, n);
        int depthLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        SplittableRandom random = new SplittableRandom(seed);

        List<Node> forest = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            int[] sample = sampleWithoutReplacement(n, psi, random);
            forest.add(build(data, sample, 0, depthLimit, random));
        }

        double normaliser = averagePathLength(psi);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double total = 0.0;
            for (Node tree : forest) total += pathLength(tree, data[i], 0);
            double meanPath = total / treeCount;
            scores[i] = normaliser > 0 ? Math.pow(2.0, -meanPath / normaliser) : 0.5;
        }
        return scores;
    }

    /** Average path length of an unsuccessful BST search over {@code n} points. */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static int[] sampleWithoutReplacement(int n, int k, SplittableRandom random) {
        int[] indices = IntStream.range(0, n).toArray();
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[k];
        System.arraycopy(indices, 0, sample, 0, k);
        return sample;
    }

    private static Node build(double[][] data, int[] rows, int depth, int depthLimit, SplittableRandom random) {
        if (depth >= depthLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }

        int features = data[rows[0]].length;
        List<Integer> splittable = new ArrayList<>(features);
        double[] min = new double[features];
        double[] max = new double[features];
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (int r : rows) {
                min[f] = Math.min(min[f], data[r][f]);
                max[f] = Math.max(max[f], data[r][f]);
            }
            if (max[f] > min[f]) splittable.add(f);
        }
        if (splittable.isEmpty()) {
            return Node.leaf(rows.length);
        }

        int feature = splittable.get(random.nextInt(splittable.size()));
        double threshold = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (int r : rows) if (data[r][feature] < threshold) leftCount++;
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int li = 0;
        int ri = 0;
        for (int r : rows) {
            if (data[r][feature] < threshold) left[li++] = r;
            else right[ri++] = r;
        }

        return Node.split(feature, threshold,
                build(data, left, depth + 1, depthLimit, random),
                build(data, right, depth + 1, depthLimit, random));
    }

    private static double pathLength(Node node, double[] point, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        Node next = point[node.feature] < node.threshold ? node.left : node.right;
        return pathLength(next, point, depth + 1);
    }

    private static final class Node {
        private final int feature;
        private final double threshold;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
