package com.jreinhal.waypoint.model;

public enum Complexity {
    SIMPLE,
    MEDIUM,
    HIGH
}
