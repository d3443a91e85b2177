package com.expensesnap.core.domain.access;

import java.util.Objects;
import java.util.UUID;

/**
 * Row filter applied to every data operation: either every company or exactly one.
 */
public final class DataScope {

    private static final DataScope ALL = new DataScope(null);

    private final UUID companyId;

    private DataScope(UUID companyId) {
        this.companyId = companyId;
    }

    public static DataScope all() {
        return ALL;
    }

    public static DataScope company(UUID companyId) {
        return new DataScope(Objects.requireNonNull(companyId, "companyId"));
    }

    public boolean isAll() {
        return companyId == null;
    }

    /** Company id of a single-company scope; null for {@link #all()}. */
    public UUID getCompanyId() {
        return companyId;
    }

    public boolean includes(UUID rowCompanyId) {
        return isAll() || companyId.equals(rowCompanyId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataScope other)) return false;
        return Objects.equals(companyId, other.companyId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(companyId);
    }

    @Override
    public String toString() {
        return isAll() ? "DataScope[all]" : "DataScope[company=" + companyId + "]";
    }
}
