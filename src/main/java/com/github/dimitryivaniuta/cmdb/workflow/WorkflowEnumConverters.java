package com.github.dimitryivaniuta.cmdb.workflow;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the workflow enums by their lowercase wire value, matching the table CHECK constraints.
 */
public final class WorkflowEnumConverters {
    private WorkflowEnumConverters() {}

    @Converter(autoApply = true)
    public static class TypeConverter implements AttributeConverter<WorkflowType, String> {
        @Override
        public String convertToDatabaseColumn(WorkflowType attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public WorkflowType convertToEntityAttribute(String dbData) {
            return dbData == null ? null : WorkflowType.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class ProviderConverter implements AttributeConverter<WorkflowProvider, String> {
        @Override
        public String convertToDatabaseColumn(WorkflowProvider attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public WorkflowProvider convertToEntityAttribute(String dbData) {
            return dbData == null ? null : WorkflowProvider.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class StatusConverter implements AttributeConverter<ExecutionStatus, String> {
        @Override
        public String convertToDatabaseColumn(ExecutionStatus attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public ExecutionStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : ExecutionStatus.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class AlertTypeConverter implements AttributeConverter<AlertType, String> {
        @Override
        public String convertToDatabaseColumn(AlertType attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public AlertType convertToEntityAttribute(String dbData) {
            return dbData == null ? null : AlertType.fromValue(dbData);
        }
    }
}
