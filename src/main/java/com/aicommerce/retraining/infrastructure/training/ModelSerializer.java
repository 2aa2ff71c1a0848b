package com.aicommerce.retraining.infrastructure.training;

import java.io.IOException;

/**
 * Converts trained model objects to and from the bytes stored in a model artifact,
 * keeping the orchestrator independent of the learning library in use.
 *
 * @author Retraining Team
 */
public interface ModelSerializer {

    byte[] serialize(Object model) throws IOException;

    Object deserialize(byte[] state) throws IOException;
}
