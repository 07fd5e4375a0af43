package com.strategyvault.config;

import com.strategyvault.util.ApiConstants;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class SwaggerGlobalHeaderConfig {

    @Bean
    public OpenApiCustomizer globalUserHeaderCustomizer() {
        return openApi -> {
            if (openApi == null || openApi.getPaths() == null) return;

            openApi.getPaths().forEach((path, pathItem) -> {
                if (pathItem == null) return;

                for (Operation operation : operationsOf(pathItem)) {
                    List<Parameter> params = operation.getParameters();
                    if (params == null) {
                        params = new ArrayList<>();
                        operation.setParameters(params);
                    }
                    boolean exists = params.stream()
                            .anyMatch(p -> ApiConstants.USER_HEADER.equals(p.getName()) && "header".equals(p.getIn()));
                    if (!exists) {
                        params.add(new Parameter()
                                .in("header")
                                .name(ApiConstants.USER_HEADER)
                                .description("Caller identity: holder, manager or admin id")
                                .schema(new StringSchema())
                                .required(false));
                    }
                }
            });
        };
    }

    private static List<Operation> operationsOf(PathItem pathItem) {
        List<Operation> operations = new ArrayList<>();
        if (pathItem.getGet() != null) operations.add(pathItem.getGet());
        if (pathItem.getPost() != null) operations.add(pathItem.getPost());
        if (pathItem.getPut() != null) operations.add(pathItem.getPut());
        if (pathItem.getDelete() != null) operations.add(pathItem.getDelete());
        return operations;
    }
}
