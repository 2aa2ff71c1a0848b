package com.aicommerce.retraining.infrastructure.training;

import weka.core.SerializationHelper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Stores Weka classifiers with Weka's own serialization helper.
 *
 * @author Retraining Team
 */
public class WekaModelSerializer implements ModelSerializer {

    @Override
    public byte[] serialize(Object model) throws IOException {
        if (model == null) {
            throw new IOException("Cannot serialize a null model");
        }
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            SerializationHelper.write(out, model);
            return out.toByteArray();
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to serialize model " + model.getClass().getName(), e);
        }
    }

    @Override
    public Object deserialize(byte[] state) throws IOException {
        if (state == null || state.length == 0) {
            throw new IOException("Model state is empty");
        }
        try (ByteArrayInputStream in = new ByteArrayInputStream(state)) {
            return SerializationHelper.read(in);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to deserialize model state", e);
        }
    }
}
