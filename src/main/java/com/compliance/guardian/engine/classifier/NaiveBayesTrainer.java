package com.compliance.guardian.engine.classifier;

import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.LabeledText;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Fits a multinomial naive Bayes model over bag-of-words term counts.
 *
 * <pre>
 *   log P(c)     = log(N_c / N)
 *   log P(t | c) = log((count(t, c) + alpha) / (sum_t count(t, c) + alpha * |V|))
 * </pre>
 *
 * Training is deterministic: the same samples in the same order give the same model.
 */
public final class NaiveBayesTrainer {

    private NaiveBayesTrainer() {
    }

    public static ClassifierModel train(List<LabeledText> samples, double alpha, int maxFeatures,
                                        String version, long trainedAt) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("No training samples");
        }
        if (alpha <= 0) {
            throw new IllegalArgumentException("Smoothing alpha must be positive, got " + alpha);
        }

        List<List<String>> documents = new ArrayList<>(samples.size());
        EnumSet<Category> labels = EnumSet.noneOf(Category.class);
        for (LabeledText sample : samples) {
            documents.add(TextTokenizer.tokenize(sample.text()));
            labels.add(sample.label());
        }

        Map<String, Integer> vocabulary = BagOfWordsVectorizer.buildVocabulary(documents, maxFeatures);
        List<Category> classes = new ArrayList<>(labels);
        int vocabularySize = vocabulary.size();

        int[] classCounts = new int[classes.size()];
        double[][] termCounts = new double[classes.size()][vocabularySize];
        double[] totalTerms = new double[classes.size()];

        for (int i = 0; i < samples.size(); i++) {
            int c = classes.indexOf(samples.get(i).label());
            classCounts[c]++;
            Map<Integer, Integer> counts = BagOfWordsVectorizer.countVector(documents.get(i), vocabulary);
            for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
                termCounts[c][entry.getKey()] += entry.getValue();
                totalTerms[c] += entry.getValue();
            }
        }

        double[] classLogPriors = new double[classes.size()];
        double[][] featureLogProbabilities = new double[classes.size()][vocabularySize];
        for (int c = 0; c < classes.size(); c++) {
            classLogPriors[c] = Math.log((double) classCounts[c] / samples.size());
            double denominator = totalTerms[c] + alpha * vocabularySize;
            for (int t = 0; t < vocabularySize; t++) {
                featureLogProbabilities[c][t] = Math.log((termCounts[c][t] + alpha) / denominator);
            }
        }

        return new ClassifierModel(version, trainedAt, samples.size(), vocabulary, classes,
                classLogPriors, featureLogProbabilities);
    }
}
