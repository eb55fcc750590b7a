/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.classification;

import com.intuitivedesigns.billingkernel.model.SpendCategory;

import java.util.List;

/**
 * Built-in AI/ML detection rules. Patterns are matched against lower-cased values.
 */
public final class DefaultClassificationRules {

    private DefaultClassificationRules() {}

    public static List<ClassificationRule> all() {
        return List.of(
                new ClassificationRule("openai-services", "OpenAI API Usage", SpendCategory.AI_SERVICE,
                        List.of("openai", "gpt", "claude", "bedrock", "comprehend", "textract", "rekognition"),
                        List.of(), List.of(), 0.95, 100),
                new ClassificationRule("aws-ai-services", "AWS AI/ML Services", SpendCategory.AI_SERVICE,
                        List.of("sagemaker", "bedrock", "comprehend", "polly", "transcribe", "translate",
                                "personalize", "forecast", "kendra", "lex", "rekognition", "textract"),
                        List.of(), List.of(), 0.9, 90),
                new ClassificationRule("azure-ai-services", "Azure AI Services", SpendCategory.AI_SERVICE,
                        List.of("cognitive services", "machine learning", "bot service", "speech services",
                                "computer vision", "language understanding", "custom vision"),
                        List.of(), List.of(), 0.9, 90),
                new ClassificationRule("gcp-ai-services", "Google Cloud AI Services", SpendCategory.AI_SERVICE,
                        List.of("ai platform", "cloud ml", "automl", "cloud vision", "cloud speech",
                                "cloud translation", "dialogflow", "vertex ai"),
                        List.of(), List.of(), 0.9, 90),
                // AWS p/g families, Azure NC/ND/NV series
                new ClassificationRule("gpu-instances", "GPU Compute Instances", SpendCategory.ML_TRAINING,
                        List.of(), List.of(),
                        List.of("p\\d+\\.", "g\\d+\\.", "nc\\d+", "nd\\d+", "nv\\d+", "gpu", "cuda", "nvidia"),
                        0.8, 80),
                new ClassificationRule("ml-training-patterns", "ML Training Resources", SpendCategory.ML_TRAINING,
                        List.of(),
                        List.of("training", "model.*train", "ml.*train", "pytorch", "tensorflow", "jupyter",
                                "notebook", "experiment"),
                        List.of(), 0.7, 70),
                new ClassificationRule("ml-inference-patterns", "ML Inference Endpoints", SpendCategory.ML_INFERENCE,
                        List.of(),
                        List.of("inference", "endpoint", "model.*serv", "predict", "api.*model", "ml.*serve"),
                        List.of(), 0.7, 70),
                new ClassificationRule("ml-data-processing", "ML Data Processing", SpendCategory.DATA_PROCESSING,
                        List.of("glue", "data factory", "dataflow", "kinesis", "stream analytics"),
                        List.of("etl", "pipeline", "feature.*store", "data.*prep"),
                        List.of(), 0.6, 60));
    }
}
