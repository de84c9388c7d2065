package com.sandstormtracker.parser;

import com.sandstormtracker.event.WeaponType;

import java.util.List;
import java.util.Locale;

// ========== Weapon Name Normalization ==========
// BP_Firearm_PF940_C_2147480339 -> "PF940" (FIREARM)
public final class WeaponNames {

    private static final String BLUEPRINT_PREFIX = "BP_";
    private static final List<String> CATEGORY_PREFIXES = List.of("Firearm_", "Weapon_", "Melee_", "Projectile_");
    private static final List<String> EXPLOSIVE_MARKERS = List.of(
        "C4", "IED", "GRENADE", "ROCKET", "RPG", "AT4", "MOLOTOV", "MORTAR", "ARTILLERY", "GAU8", "MINE", "FRAG");
    private static final List<String> VEHICLE_MARKERS = List.of("VEHICLE", "TECHNICAL", "BTR");

    private WeaponNames() {}

    public static String clean(String raw) {
        String weapon = raw.trim();
        if (weapon.startsWith(BLUEPRINT_PREFIX)) {
            weapon = weapon.substring(BLUEPRINT_PREFIX.length());
        }

        int lastUnderscore = weapon.lastIndexOf('_');
        if (lastUnderscore >= 0 && isDigits(weapon.substring(lastUnderscore + 1))) {
            weapon = weapon.substring(0, lastUnderscore);
        }
        if (weapon.endsWith("_C")) {
            weapon = weapon.substring(0, weapon.length() - 2);
        }

        if (weapon.equals("Character") || weapon.startsWith("Character_")) {
            return "Fall Damage";
        }
        for (String prefix : CATEGORY_PREFIXES) {
            if (weapon.startsWith(prefix)) {
                weapon = weapon.substring(prefix.length());
                break;
            }
        }

        weapon = weapon.replace('_', ' ').trim();
        if (weapon.startsWith("ODCheckpoint ")) {
            weapon = "ODCheckpoint";
        }
        return weapon.isEmpty() ? "Unknown" : weapon;
    }

    public static WeaponType typeOf(String raw) {
        String weapon = raw.trim();
        if (!weapon.startsWith(BLUEPRINT_PREFIX)) {
            return WeaponType.OTHER;
        }
        String rest = weapon.substring(BLUEPRINT_PREFIX.length());
        int underscore = rest.indexOf('_');
        String category = underscore >= 0 ? rest.substring(0, underscore) : rest;

        return switch (category) {
            case "Firearm", "Weapon" -> WeaponType.FIREARM;
            case "Projectile" -> WeaponType.PROJECTILE;
            case "Melee" -> WeaponType.MELEE;
            case "Character" -> WeaponType.ENVIRONMENT;
            default -> category.contains("Vehicle") ? WeaponType.VEHICLE : WeaponType.OTHER;
        };
    }

    public static boolean isExplosive(String weapon, WeaponType type) {
        if (type == WeaponType.PROJECTILE) {
            return true;
        }
        String upper = weapon.toUpperCase(Locale.ROOT);
        return EXPLOSIVE_MARKERS.stream().anyMatch(upper::contains);
    }

    public static boolean isVehicle(String weapon, WeaponType type) {
        if (type == WeaponType.VEHICLE) {
            return true;
        }
        String upper = weapon.toUpperCase(Locale.ROOT);
        return VEHICLE_MARKERS.stream().anyMatch(upper::contains);
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
