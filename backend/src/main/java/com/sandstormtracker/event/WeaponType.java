package com.sandstormtracker.event;

public enum WeaponType {
    FIREARM,
    PROJECTILE,
    MELEE,
    VEHICLE,
    ENVIRONMENT,
    OTHER
}
