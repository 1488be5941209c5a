package net.custodian.adapter.jdbc.repo;

import java.time.Instant;

/** TB_OPTION 한 행 */
public record StoredOption(String name, String value, Instant updatedAt) {}
