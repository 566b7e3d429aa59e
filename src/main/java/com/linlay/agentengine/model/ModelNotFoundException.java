package com.linlay.agentengine.model;

import com.linlay.agentengine.error.NotFoundException;

public class ModelNotFoundException extends NotFoundException {

    public ModelNotFoundException(String modelId) {
        super("Model", modelId);
    }
}
