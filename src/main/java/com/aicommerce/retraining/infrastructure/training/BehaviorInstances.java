package com.aicommerce.retraining.infrastructure.training;

import com.aicommerce.retraining.domain.model.BehaviorFeatures;
import com.aicommerce.retraining.domain.model.ModelTask;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Weka dataset layout shared by training and scoring.
 *
 * Input attributes (numeric): eventCount, pageViews, cartAdds, totalSessionDuration, avgSessionDuration.
 * Class attribute: nominal {retained, churned} for CHURN, numeric spendingScore for SPENDING.
 *
 * @author Retraining Team
 */
public final class BehaviorInstances {

    public static final String CLASS_RETAINED = "retained";
    public static final String CLASS_CHURNED = "churned";

    static final List<String> FEATURE_NAMES = List.of(
            "eventCount", "pageViews", "cartAdds", "totalSessionDuration", "avgSessionDuration");

    private BehaviorInstances() {
    }

    /**
     * Empty dataset with the attribute layout for a task and the class index set.
     */
    public static Instances header(ModelTask task, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String name : FEATURE_NAMES) {
            attributes.add(new Attribute(name));
        }
        if (task == ModelTask.CHURN) {
            attributes.add(new Attribute("churn", List.of(CLASS_RETAINED, CLASS_CHURNED)));
        } else {
            attributes.add(new Attribute("spendingScore"));
        }

        Instances instances = new Instances(task.name().toLowerCase() + "_behavior", attributes, capacity);
        instances.setClassIndex(attributes.size() - 1);
        return instances;
    }

    /**
     * Labelled dataset for training.
     */
    public static Instances labelled(ModelTask task, List<BehaviorFeatures> rows) {
        Instances instances = header(task, rows.size());
        for (BehaviorFeatures row : rows) {
            double label = task == ModelTask.CHURN
                    ? (row.churned() ? 1.0 : 0.0)
                    : row.spendingScore();
            instances.add(new DenseInstance(1.0, values(row, label)));
        }
        return instances;
    }

    /**
     * Unlabelled instance attached to {@code header}, ready for scoring.
     */
    public static Instance unlabelled(Instances header, BehaviorFeatures row) {
        Instance instance = new DenseInstance(1.0, values(row, 0.0));
        instance.setDataset(header);
        instance.setClassMissing();
        return instance;
    }

    private static double[] values(BehaviorFeatures row, double label) {
        return new double[] {
                row.eventCount(),
                row.pageViews(),
                row.cartAdds(),
                row.totalSessionDuration(),
                row.avgSessionDuration(),
                label
        };
    }
}
