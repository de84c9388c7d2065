package com.sandstormtracker.parser;

import com.sandstormtracker.event.WeaponType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class WeaponNamesTest {

    @ParameterizedTest
    @CsvSource({
        "BP_Firearm_PF940_C_2147480339, PF940, FIREARM",
        "BP_Firearm_M16A2_C_2147481419, M16A2, FIREARM",
        "BP_Firearm_AK74_C_2147477321, AK74, FIREARM",
        "BP_Melee_Knife_C_2147479990, Knife, MELEE",
        "BP_Projectile_Molotov_C_2147463122, Molotov, PROJECTILE",
        "BP_Projectile_F1_C_2147470011, F1, PROJECTILE",
        "BP_Projectile_Mortar_HE_C_2147480348, Mortar HE, PROJECTILE",
        "BP_GAU8_C_2147465432, GAU8, OTHER",
        "BP_ODCheckpoint_Defender_C_2147471234, ODCheckpoint, OTHER",
        "BP_Character_Player_C_2147482001, Fall Damage, ENVIRONMENT",
    })
    void cleansBlueprintNames(String raw, String name, WeaponType type) {
        assertThat(WeaponNames.clean(raw)).isEqualTo(name);
        assertThat(WeaponNames.typeOf(raw)).isEqualTo(type);
    }

    @Test
    void stripsCategoryWithoutBlueprintPrefix() {
        assertThat(WeaponNames.clean("Weapon_X")).isEqualTo("X");
        assertThat(WeaponNames.typeOf("Weapon_X")).isEqualTo(WeaponType.OTHER);
    }

    @Test
    void fallsBackToUnknownForEmptyNames() {
        assertThat(WeaponNames.clean("BP_")).isEqualTo("Unknown");
    }

    @Test
    void flagsExplosivesAndVehicles() {
        assertThat(WeaponNames.isExplosive("Molotov", WeaponType.PROJECTILE)).isTrue();
        assertThat(WeaponNames.isExplosive("GAU8", WeaponType.OTHER)).isTrue();
        assertThat(WeaponNames.isExplosive("C4 Detonator", WeaponType.OTHER)).isTrue();
        assertThat(WeaponNames.isExplosive("M16A4", WeaponType.FIREARM)).isFalse();

        assertThat(WeaponNames.isVehicle("BTR Cannon", WeaponType.OTHER)).isTrue();
        assertThat(WeaponNames.isVehicle("Anything", WeaponType.VEHICLE)).isTrue();
        assertThat(WeaponNames.isVehicle("AK74", WeaponType.FIREARM)).isFalse();
    }
}
