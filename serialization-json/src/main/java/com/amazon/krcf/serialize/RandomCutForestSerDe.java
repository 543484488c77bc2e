/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */


package com.amazon.krcf.serialize;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.krcf.ErrorKind;
import com.amazon.krcf.RandomCutForest;
import com.amazon.krcf.RandomCutForestException;
import com.amazon.krcf.state.ExecutionContext;
import com.amazon.krcf.state.RandomCutForestMapper;
import com.amazon.krcf.state.RandomCutForestState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * {@link RandomCutForest} serialization. Internally we use the
 * {@link RandomCutForestMapper} class to convert a RandomCutForest into a
 * corresponding state object, and we use
 * <a href="https://github.com/google/gson">Gson</a> to write the state object
 * as a JSON string. The Gson instance is exposed so users can customize the
 * output (e.g., by enabling pretty printing).
 * <p>
 * Serialization reads the forest without locking it; callers must not update
 * the forest while {@link #toJson} runs.
 */
@Getter
public class RandomCutForestSerDe {

    private static final Logger logger = LogManager.getLogger(RandomCutForestSerDe.class);

    private final RandomCutForestMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public RandomCutForestSerDe() {
        this(new RandomCutForestMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper A RandomCutForestMapper instance, used to convert a
     *               RandomCutForest to a corresponding state object.
     * @param gson   A Gson instance that will be used to generate JSON for a given
     *               {@link RandomCutForestState} object.
     */
    public RandomCutForestSerDe(RandomCutForestMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * Serializes a RCF object to a json string.
     *
     * @param forest A Random Cut Forest
     * @return a json string serialized from the Random Cut Forest.
     * @throws RandomCutForestException of kind {@link ErrorKind#SERIALIZATION} if
     *                                  the state cannot be written
     */
    public String toJson(RandomCutForest forest) {
        RandomCutForestState state = mapper.toState(forest);
        try {
            return gson.toJson(state);
        } catch (JsonParseException | IllegalArgumentException e) {
            logger.error("failed to write forest state: {}", e.getMessage());
            throw new RandomCutForestException(ErrorKind.SERIALIZATION, "failed to write forest state", e);
        }
    }

    /**
     * Deserializes a serialized Random Cut Forest JSON string to a Random Cut
     * Forest object, using the execution context saved in the string.
     *
     * @param json a json string serialized from a RCF
     * @return a RCF deserialized from the string
     * @throws RandomCutForestException of kind
     *                                  {@link ErrorKind#DESERIALIZATION} if the
     *                                  string is not a valid forest state
     */
    public RandomCutForest fromJson(String json) {
        return fromJson(json, null);
    }

    /**
     * Deserializes a serialized Random Cut Forest JSON string to a Random Cut
     * Forest object.
     *
     * @param json    A json string serialized from a RCF
     * @param context An execution context that determines the execution properties
     *                of the deserialized forest, or null to use the saved one.
     * @return a RCF deserialized from the string
     */
    public RandomCutForest fromJson(String json, ExecutionContext context) {
        if (json == null) {
            throw new RandomCutForestException(ErrorKind.DESERIALIZATION, "json must not be null");
        }
        RandomCutForestState state;
        try {
            state = gson.fromJson(json, RandomCutForestState.class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new RandomCutForestException(ErrorKind.DESERIALIZATION, "malformed forest state", e);
        }
        return mapper.toModel(state, context);
    }
}
