package com.github.dimitryivaniuta.cmdb.report;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Report enums are stored by wire value.
 */
public final class ReportEnumConverters {
    private ReportEnumConverters() {}

    @Converter(autoApply = true)
    public static class ReportTypeConverter implements AttributeConverter<ReportType, String> {
        @Override
        public String convertToDatabaseColumn(ReportType attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public ReportType convertToEntityAttribute(String dbData) {
            return dbData == null ? null : ReportType.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class CategoryConverter implements AttributeConverter<ReportCategory, String> {
        @Override
        public String convertToDatabaseColumn(ReportCategory attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public ReportCategory convertToEntityAttribute(String dbData) {
            return dbData == null ? null : ReportCategory.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class ProviderConverter implements AttributeConverter<CloudProvider, String> {
        @Override
        public String convertToDatabaseColumn(CloudProvider attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public CloudProvider convertToEntityAttribute(String dbData) {
            return dbData == null ? null : CloudProvider.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class ExecutionStatusConverter implements AttributeConverter<ReportExecutionStatus, String> {
        @Override
        public String convertToDatabaseColumn(ReportExecutionStatus attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public ReportExecutionStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : ReportExecutionStatus.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class TriggerConverter implements AttributeConverter<TriggerType, String> {
        @Override
        public String convertToDatabaseColumn(TriggerType attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public TriggerType convertToEntityAttribute(String dbData) {
            return dbData == null ? null : TriggerType.fromValue(dbData);
        }
    }
}
