package com.codesurvey.core.analyzer;

import com.codesurvey.core.exception.SurveyConfigurationException;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for analyzers that turn a unit of code into a representation and apply
 * a fixed set of named {@link FeatureFinder}s to it.
 *
 * <p>Subclasses implement {@link #prepareCode(Repo, String)} and unit enumeration.
 * A {@code null} representation marks the unit as skipped for every requested feature.
 *
 * @param <T> code representation type
 */
public abstract class AbstractAnalyzer<T> implements Analyzer<T> {

    protected final Logger log;

    private final String name;
    private final Map<String, FeatureFinder<T>> featureFinders;

    /**
     * @param featureFinders finders applied to each unit
     * @param name analyzer name, or {@code null} to use {@link #getDefaultName()}
     * @throws SurveyConfigurationException if two finders share a name
     */
    protected AbstractAnalyzer(List<FeatureFinder<T>> featureFinders, String name) {
        this.log = LoggerFactory.getLogger(getClass());
        this.name = Names.requireName(name != null ? name : getDefaultName(), "Analyzer");

        List<String> duplicates = Names.duplicates(featureFinders.stream().map(FeatureFinder::getName).toList());
        if (!duplicates.isEmpty()) {
            throw new SurveyConfigurationException("Cannot create analyzer \"" + this.name
                + "\" with duplicate feature names: " + String.join(", ", duplicates)
                + ". Please set a unique name for each feature finder.");
        }
        Map<String, FeatureFinder<T>> finders = new LinkedHashMap<>();
        featureFinders.forEach(finder -> finders.put(finder.getName(), finder));
        this.featureFinders = finders;
    }

    protected abstract String getDefaultName();

    /**
     * Prepares the representation of a unit handed to the feature finders.
     *
     * @param repo repository containing the unit
     * @param codeKey unit key within the repository
     * @return code representation, or {@code null} to skip the unit
     */
    protected abstract T prepareCode(Repo repo, String codeKey);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getFeatureNames() {
        return List.copyOf(featureFinders.keySet());
    }

    @Override
    public Code analyzeCode(Repo repo, String codeKey, List<String> features) {
        T code = prepareCode(repo, codeKey);
        Map<String, Feature> results = new LinkedHashMap<>();
        for (String featureName : features) {
            FeatureFinder<T> finder = featureFinders.get(featureName);
            if (finder == null) {
                throw new IllegalArgumentException("Analyzer \"" + name + "\" has no feature named \"" + featureName + "\"");
            }
            results.put(featureName, code == null ? Feature.skipped() : finder.find(code));
        }
        return new Code(this, repo, codeKey, results);
    }

    @Override
    public String toString() {
        return name;
    }
}
