package com.compliance.guardian.engine.classifier;

import com.compliance.guardian.model.Category;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable multinomial naive Bayes snapshot. Once published it is shared by
 * every classification call, so nothing here may change after construction.
 */
public final class ClassifierModel {

    private final String version;
    private final long trainedAt;
    private final int trainingSamples;
    private final Map<String, Integer> vocabulary;
    private final List<Category> classes;
    private final double[] classLogPriors;
    private final double[][] featureLogProbabilities;

    @JsonCreator
    public ClassifierModel(@JsonProperty("version") String version,
                           @JsonProperty("trainedAt") long trainedAt,
                           @JsonProperty("trainingSamples") int trainingSamples,
                           @JsonProperty("vocabulary") Map<String, Integer> vocabulary,
                           @JsonProperty("classes") List<Category> classes,
                           @JsonProperty("classLogPriors") double[] classLogPriors,
                           @JsonProperty("featureLogProbabilities") double[][] featureLogProbabilities) {
        if (classes == null || classes.isEmpty()) {
            throw new IllegalArgumentException("A model needs at least one class");
        }
        if (classLogPriors == null || classLogPriors.length != classes.size()
                || featureLogProbabilities == null || featureLogProbabilities.length != classes.size()) {
            throw new IllegalArgumentException("Class parameter arrays do not match the class list");
        }
        int vocabularySize = vocabulary != null ? vocabulary.size() : 0;
        double[][] features = new double[featureLogProbabilities.length][];
        for (int c = 0; c < featureLogProbabilities.length; c++) {
            if (featureLogProbabilities[c] == null || featureLogProbabilities[c].length != vocabularySize) {
                throw new IllegalArgumentException("Feature parameters for class " + classes.get(c)
                        + " do not match the vocabulary size " + vocabularySize);
            }
            features[c] = featureLogProbabilities[c].clone();
        }

        this.version = version;
        this.trainedAt = trainedAt;
        this.trainingSamples = trainingSamples;
        this.vocabulary = vocabulary != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(vocabulary))
                : Collections.emptyMap();
        this.classes = List.copyOf(classes);
        this.classLogPriors = classLogPriors.clone();
        this.featureLogProbabilities = features;
    }

    /**
     * Posterior probability of every known class for the given tokens.
     * Classes the model was not trained on are absent from the result.
     */
    public Map<Category, Double> predictProbabilities(List<String> tokens) {
        Map<Integer, Integer> counts = BagOfWordsVectorizer.countVector(tokens, vocabulary);

        double[] jointLogLikelihood = new double[classes.size()];
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < classes.size(); c++) {
            double score = classLogPriors[c];
            for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
                score += entry.getValue() * featureLogProbabilities[c][entry.getKey()];
            }
            jointLogLikelihood[c] = score;
            max = Math.max(max, score);
        }

        // log-sum-exp normalization
        double sum = 0.0;
        double[] unnormalized = new double[classes.size()];
        for (int c = 0; c < classes.size(); c++) {
            unnormalized[c] = Math.exp(jointLogLikelihood[c] - max);
            sum += unnormalized[c];
        }

        Map<Category, Double> posteriors = new EnumMap<>(Category.class);
        for (int c = 0; c < classes.size(); c++) {
            posteriors.put(classes.get(c), unnormalized[c] / sum);
        }
        return posteriors;
    }

    public String getVersion() {
        return version;
    }

    public long getTrainedAt() {
        return trainedAt;
    }

    public int getTrainingSamples() {
        return trainingSamples;
    }

    public Map<String, Integer> getVocabulary() {
        return vocabulary;
    }

    public List<Category> getClasses() {
        return classes;
    }

    public double[] getClassLogPriors() {
        return classLogPriors.clone();
    }

    public double[][] getFeatureLogProbabilities() {
        double[][] copy = new double[featureLogProbabilities.length][];
        for (int c = 0; c < featureLogProbabilities.length; c++) {
            copy[c] = featureLogProbabilities[c].clone();
        }
        return copy;
    }

    @JsonIgnore
    public int getVocabularySize() {
        return vocabulary.size();
    }

    @Override
    public String toString() {
        return "ClassifierModel{version=" + version + ", classes=" + classes
                + ", vocabulary=" + vocabulary.size() + ", samples=" + trainingSamples
                + ", priors=" + Arrays.toString(classLogPriors) + "}";
    }
}
