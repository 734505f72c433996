package com.has.domain.catalog.entity;

public enum CameroonProvince {
    CENTRE,
    LITTORAL,
    WEST,
    NORTHWEST,
    SOUTHWEST,
    SOUTH,
    EAST,
    NORTH,
    ADAMAWA,
    FAR_NORTH
}
