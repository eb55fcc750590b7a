/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.emissions;

import java.util.List;

/**
 * Reference factors (kg CO2 per dollar) from Cloud Carbon Footprint and published estimates.
 */
public final class DefaultCoefficients {

    private DefaultCoefficients() {}

    public static List<Co2Coefficient> all() {
        return List.of(
                Co2Coefficient.perDollar("aws-ec2-us-east-1", "aws", "Amazon Elastic Compute Cloud", "Compute",
                        "us-east-1", 0.45, 0.8, "cloud_carbon_footprint"),
                // cleaner grid in the EU
                Co2Coefficient.perDollar("aws-ec2-eu-west-1", "aws", "Amazon Elastic Compute Cloud", "Compute",
                        "eu-west-1", 0.25, 0.8, "cloud_carbon_footprint"),
                Co2Coefficient.perDollar("azure-compute-eastus", "azure", "Virtual Machines", "Compute",
                        "East US", 0.48, 0.7, "estimated"),
                Co2Coefficient.perDollar("aws-s3-global", "aws", "Amazon Simple Storage Service", "Storage",
                        Co2Coefficient.GLOBAL_REGION, 0.15, 0.6, "estimated"),
                Co2Coefficient.perDollar("generic-compute", "generic", "generic-compute", null,
                        Co2Coefficient.GLOBAL_REGION, 0.4, 0.3, "estimated"),
                Co2Coefficient.perDollar("generic-storage", "generic", "generic-storage", null,
                        Co2Coefficient.GLOBAL_REGION, 0.2, 0.3, "estimated"));
    }

    public static CoefficientSource source() {
        return context -> all();
    }
}
