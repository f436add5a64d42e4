package com.jreinhal.waypoint.model;

public enum PlanTier {
    STARTER,
    PLUS,
    PRO,
    APEX
}
