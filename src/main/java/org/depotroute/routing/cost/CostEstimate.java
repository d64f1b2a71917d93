package org.depotroute.routing.cost;

import lombok.Value;

/**
 * Fuel cost and emissions for one distance.
 */
@Value
public class CostEstimate {
    double fuelCost;
    double co2Kg;
}
