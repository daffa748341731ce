package com.casework.core.matching;

/**
 * Attributes a candidate may constrain and a record may supply.
 */
public enum MatchDimension {
    CLASSIFICATION,
    LOCATION,
    DEPARTMENT,
    CHANNEL,
    RECORD_TYPE
}
