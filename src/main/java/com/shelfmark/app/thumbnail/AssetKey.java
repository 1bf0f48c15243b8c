package com.shelfmark.app.thumbnail;

import com.shelfmark.app.database.CatalogKind;

public record AssetKey(CatalogKind kind, long id) {

    @Override
    public String toString() {
        return kind.table() + "#" + id;
    }
}
