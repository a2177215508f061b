package com.stationery.tracker.model;

public enum UnitType {
    CARTON, PIECE, BOX, PACK
}
