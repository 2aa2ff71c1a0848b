package com.aicommerce.retraining.infrastructure.training;

import com.aicommerce.retraining.domain.model.CandidateModel;
import com.aicommerce.retraining.domain.model.DatasetSnapshot;
import com.aicommerce.retraining.domain.model.ModelTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.Classifier;
import weka.classifiers.Evaluation;
import weka.classifiers.functions.LinearRegression;
import weka.classifiers.functions.Logistic;
import weka.core.Instances;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Default trainer backed by Weka.
 *
 * - CHURN: logistic regression, reports accuracy (primary) and AUC
 * - SPENDING: linear regression, reports mse (primary) and mae
 *
 * The dataset is shuffled with a fixed seed and split 80/20 into train and
 * hold-out sets, so identical snapshots always produce identical metrics.
 *
 * @author Retraining Team
 */
public class WekaBehaviorTrainer implements Trainer {

    private static final Logger logger = LoggerFactory.getLogger(WekaBehaviorTrainer.class);

    static final long SPLIT_SEED = 42L;
    static final double TRAIN_FRACTION = 0.8;

    private final ModelSerializer serializer;
    private final int minTrainableSamples;

    public WekaBehaviorTrainer(ModelSerializer serializer, int minTrainableSamples) {
        this.serializer = serializer;
        this.minTrainableSamples = minTrainableSamples;
    }

    @Override
    public CandidateModel train(ModelTask task, DatasetSnapshot snapshot) throws TrainingException {
        int rows = snapshot.getRows().size();
        if (rows < minTrainableSamples) {
            throw new InsufficientDataException(task, rows, minTrainableSamples);
        }

        Instances data = BehaviorInstances.labelled(task, snapshot.getRows());
        data.randomize(new Random(SPLIT_SEED));

        int trainSize = (int) Math.round(rows * TRAIN_FRACTION);
        int testSize = rows - trainSize;
        if (trainSize == 0 || testSize == 0) {
            throw new InsufficientDataException(task, rows, minTrainableSamples);
        }

        Instances train = new Instances(data, 0, trainSize);
        Instances test = new Instances(data, trainSize, testSize);

        if (task == ModelTask.CHURN) {
            requireBothClasses(task, train);
        }

        long startTime = System.currentTimeMillis();
        Classifier classifier = task == ModelTask.CHURN ? new Logistic() : new LinearRegression();
        Map<String, Double> metrics;
        try {
            classifier.buildClassifier(train);
            Evaluation evaluation = new Evaluation(train);
            evaluation.evaluateModel(classifier, test);
            metrics = task == ModelTask.CHURN
                    ? classificationMetrics(evaluation, train)
                    : regressionMetrics(evaluation);
        } catch (Exception e) {
            throw new TrainingException(task, "Weka training failed: " + e.getMessage(), e);
        }

        byte[] state;
        try {
            state = serializer.serialize(classifier);
        } catch (IOException e) {
            throw new TrainingException(task, "Failed to serialize trained model", e);
        }

        logger.info("Trained {} candidate on {} rows ({} train / {} hold-out) in {}ms: {}",
                task, rows, trainSize, testSize, System.currentTimeMillis() - startTime, metrics);

        return new CandidateModel(task, state, metrics, rows);
    }

    private static void requireBothClasses(ModelTask task, Instances train) throws TrainingException {
        int[] counts = train.attributeStats(train.classIndex()).nominalCounts;
        if (counts[0] == 0 || counts[1] == 0) {
            throw new TrainingException(task,
                    "Training split contains a single churn class; cannot fit a classifier");
        }
    }

    private static Map<String, Double> classificationMetrics(Evaluation evaluation, Instances train) {
        Map<String, Double> metrics = new HashMap<>();
        metrics.put("accuracy", evaluation.pctCorrect() / 100.0);
        int churnedIndex = train.classAttribute().indexOfValue(BehaviorInstances.CLASS_CHURNED);
        double auc = evaluation.areaUnderROC(churnedIndex);
        // AUC is undefined when the hold-out set has one class only
        if (!Double.isNaN(auc)) {
            metrics.put("auc", auc);
        }
        return metrics;
    }

    private static Map<String, Double> regressionMetrics(Evaluation evaluation) {
        Map<String, Double> metrics = new HashMap<>();
        double rmse = evaluation.rootMeanSquaredError();
        metrics.put("mse", rmse * rmse);
        metrics.put("mae", evaluation.meanAbsoluteError());
        return metrics;
    }
}
