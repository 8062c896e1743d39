package com.unifiedplatform.backend.modules.schema.application;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.unifiedplatform.backend.modules.event.presentation.dto.ScheduleEventRequest;
import com.unifiedplatform.backend.modules.notification.presentation.dto.CreateNotificationRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateBranchRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateResourceRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateRoleRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateUserRequest;
import com.unifiedplatform.backend.modules.report.presentation.dto.SubmitEvaluationRequest;
import com.unifiedplatform.backend.modules.report.presentation.dto.SubmitReportRequest;
import com.unifiedplatform.backend.modules.request.presentation.dto.BudgetItemInput;
import com.unifiedplatform.backend.modules.request.presentation.dto.RecordApprovalRequest;
import com.unifiedplatform.backend.modules.request.presentation.dto.SubmitProgramRequest;
import com.unifiedplatform.backend.modules.schema.presentation.dto.SchemaFieldResponse;
import com.unifiedplatform.backend.modules.schema.presentation.dto.SchemaModelResponse;

import org.springframework.stereotype.Service;

/**
 * Describes the payloads clients post, for admin tooling. Field names are the wire names produced by the
 * application's {@link ObjectMapper}, in declaration order.
 */
@Service
public class SchemaIntrospectionService {

    private static final List<PayloadModel> PAYLOAD_MODELS = List.of(
            new PayloadModel("branch", CreateBranchRequest.class),
            new PayloadModel("role", CreateRoleRequest.class),
            new PayloadModel("user", CreateUserRequest.class),
            new PayloadModel("budget_item", BudgetItemInput.class),
            new PayloadModel("program_request", SubmitProgramRequest.class),
            new PayloadModel("approval", RecordApprovalRequest.class),
            new PayloadModel("resource", CreateResourceRequest.class),
            new PayloadModel("event", ScheduleEventRequest.class),
            new PayloadModel("report", SubmitReportRequest.class),
            new PayloadModel("evaluation", SubmitEvaluationRequest.class),
            new PayloadModel("notification", CreateNotificationRequest.class)
    );

    private final SerializationConfig serializationConfig;

    public SchemaIntrospectionService(ObjectMapper objectMapper) {
        this.serializationConfig = objectMapper.getSerializationConfig();
    }

    public List<SchemaModelResponse> describeModels() {
        return PAYLOAD_MODELS.stream()
                .map(model -> new SchemaModelResponse(model.name(), describeFields(model.payload())))
                .toList();
    }

    private List<SchemaFieldResponse> describeFields(Class<? extends Record> payload) {
        return Arrays.stream(payload.getRecordComponents())
                .map(component -> new SchemaFieldResponse(wireName(component), typeName(component.getGenericType())))
                .toList();
    }

    private String wireName(RecordComponent component) {
        JsonProperty explicit = component.getAccessor().getAnnotation(JsonProperty.class);
        if (explicit != null && !explicit.value().isEmpty()) {
            return explicit.value();
        }
        PropertyNamingStrategy strategy = serializationConfig.getPropertyNamingStrategy();
        if (strategy == null) {
            return component.getName();
        }
        return strategy.nameForField(serializationConfig, null, component.getName());
    }

    static String typeName(Type type) {
        if (type instanceof ParameterizedType parameterized) {
            String arguments = Arrays.stream(parameterized.getActualTypeArguments())
                    .map(SchemaIntrospectionService::typeName)
                    .collect(Collectors.joining(", "));
            return typeName(parameterized.getRawType()) + "<" + arguments + ">";
        }
        if (type instanceof Class<?> cls) {
            return cls.getSimpleName();
        }
        return type.getTypeName();
    }

    private record PayloadModel(String name, Class<? extends Record> payload) {
    }
}
