package io.troupe.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.troupe.core.report.Report;

/**
 * Binds {@code Report} deserialization to its builder, so exported reports can be read back
 * by presentation consumers and trend lookups.
 *
 * @see ReportBuilderMixin
 */
@JsonDeserialize(builder = Report.Builder.class)
public abstract class ReportMixin {}
