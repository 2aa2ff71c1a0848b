package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.BehaviorFeatures;
import com.aicommerce.retraining.domain.model.ModelArtifact;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.Prediction;
import com.aicommerce.retraining.exception.ModelLoadException;
import com.aicommerce.retraining.exception.ResourceNotFoundException;
import com.aicommerce.retraining.infrastructure.training.BehaviorInstances;
import com.aicommerce.retraining.infrastructure.training.ModelSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import weka.classifiers.Classifier;
import weka.core.Instance;
import weka.core.Instances;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scores users with the current production model of a task.
 *
 * Reads the production pointer without taking any retraining lock, so scoring keeps
 * running while a retrain is in flight and switches to a new version on the first
 * call after promotion or rollback. The deserialized classifier is cached per task
 * and reloaded when the production version changes.
 *
 * @author Retraining Team
 */
@Service
public class ModelPredictionService {

    private static final Logger logger = LoggerFactory.getLogger(ModelPredictionService.class);

    private final ModelStore modelStore;
    private final ModelSerializer modelSerializer;
    private final Map<ModelTask, AtomicReference<LoadedModel>> loaded = new EnumMap<>(ModelTask.class);

    public ModelPredictionService(ModelStore modelStore, ModelSerializer modelSerializer) {
        this.modelStore = modelStore;
        this.modelSerializer = modelSerializer;
        for (ModelTask task : ModelTask.values()) {
            loaded.put(task, new AtomicReference<>());
        }
    }

    /**
     * Score one user with the production model of a task.
     *
     * @param task Model task
     * @param features Aggregated behavior of the user
     * @return prediction tagged with the model version used
     * @throws ResourceNotFoundException if the task has no production model
     * @throws ModelLoadException if the artifact cannot be deserialized or scored
     */
    public Prediction predict(ModelTask task, BehaviorFeatures features) {
        ModelArtifact production = modelStore.getProduction(task)
                .orElseThrow(() -> new ResourceNotFoundException("ProductionModel", task.name()));

        LoadedModel model = load(production);
        Instance instance = BehaviorInstances.unlabelled(model.header(), features);

        // Weka filters inside the classifiers keep per-call state
        synchronized (model.classifier()) {
            try {
                double score;
                if (task == ModelTask.CHURN) {
                    int churnedIndex = model.header().classAttribute().indexOfValue(BehaviorInstances.CLASS_CHURNED);
                    score = model.classifier().distributionForInstance(instance)[churnedIndex];
                } else {
                    score = model.classifier().classifyInstance(instance);
                }
                return new Prediction(task, production.getVersion(), score);
            } catch (Exception e) {
                throw new ModelLoadException(task, production.getVersion(), e);
            }
        }
    }

    private LoadedModel load(ModelArtifact artifact) {
        AtomicReference<LoadedModel> slot = loaded.get(artifact.getTask());
        LoadedModel cached = slot.get();
        if (cached != null && cached.version() == artifact.getVersion()) {
            return cached;
        }

        Object model;
        try {
            model = modelSerializer.deserialize(artifact.getState());
        } catch (IOException e) {
            throw new ModelLoadException(artifact.getTask(), artifact.getVersion(), e);
        }
        if (!(model instanceof Classifier)) {
            throw new ModelLoadException(artifact.getTask(), artifact.getVersion(),
                    new IOException("Stored state is not a Weka classifier: " + model.getClass().getName()));
        }

        LoadedModel fresh = new LoadedModel(artifact.getVersion(), (Classifier) model,
                BehaviorInstances.header(artifact.getTask(), 1));
        slot.set(fresh);
        logger.info("Loaded {} v{} for scoring", artifact.getTask(), artifact.getVersion());
        return fresh;
    }

    private record LoadedModel(long version, Classifier classifier, Instances header) {
    }
}
