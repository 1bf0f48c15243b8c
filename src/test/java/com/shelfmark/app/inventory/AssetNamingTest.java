package com.shelfmark.app.inventory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AssetNamingTest {

    @Test
    void titlesComeFromTheFileName() {
        assertEquals("dragon bust v2", AssetNaming.title("dragon_bust-v2.stl"));
        assertEquals("2024 price list", AssetNaming.title("2024_price_list.pdf"));
    }

    @Test
    void modelTitlesDropLeadingSequenceNumbers() {
        assertEquals("tower", AssetNaming.modelTitle("03_tower.stl"));
        assertEquals("gate house", AssetNaming.modelTitle("12-gate_house.obj"));
        assertEquals("1000", AssetNaming.modelTitle("1000.stl"));
    }

    @Test
    void creatorIsTheFolderAboveTheCollection() {
        assertEquals("Artisan", AssetNaming.creator("Artisan/castle_set/tower.stl", null));
        assertEquals("Artisan", AssetNaming.creator("minis/Artisan/castle_set/tower.stl", null));
        assertEquals("Artisan", AssetNaming.creator("Artisan/castle_set.zip::models/tower.stl", "Artisan/castle_set.zip"));
    }

    @Test
    void noCreatorWithoutAMeaningfulFolder() {
        assertNull(AssetNaming.creator("castle_set/tower.stl", null));
        assertNull(AssetNaming.creator("tower.stl", null));
        assertNull(AssetNaming.creator("castle_set.zip::tower.stl", "castle_set.zip"));
        assertNull(AssetNaming.creator("STL/castle_set/tower.stl", null));
    }
}
