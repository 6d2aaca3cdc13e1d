package com.radioss.translator.model;

import lombok.Value;

/**
 * A mesh node: positive identifier plus its global coordinates.
 */
@Value
public class Node {
    int id;
    double x;
    double y;
    double z;
}
