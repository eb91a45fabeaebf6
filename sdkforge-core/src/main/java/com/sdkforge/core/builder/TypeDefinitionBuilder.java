package com.sdkforge.core.builder;

import static com.sdkforge.core.builder.AstShortcuts.assign;
import static com.sdkforge.core.builder.AstShortcuts.param;
import static com.sdkforge.core.builder.AstShortcuts.requireField;

import com.sdkforge.core.ast.DocComment;
import com.sdkforge.core.ast.SdkAst.ClassDeclaration;
import com.sdkforge.core.ast.SdkAst.Constructor;
import com.sdkforge.core.ast.SdkAst.Declaration;
import com.sdkforge.core.ast.SdkAst.EnumDeclaration;
import com.sdkforge.core.ast.SdkAst.EnumMember;
import com.sdkforge.core.ast.SdkAst.InterfaceDeclaration;
import com.sdkforge.core.ast.SdkAst.MethodDeclaration;
import com.sdkforge.core.ast.SdkAst.ObjectExpression;
import com.sdkforge.core.ast.SdkAst.ObjectProperty;
import com.sdkforge.core.ast.SdkAst.PropertyDeclaration;
import com.sdkforge.core.ast.SdkAst.ReturnStatement;
import com.sdkforge.core.model.EnumValueDescriptor;
import com.sdkforge.core.model.FieldDescriptor;
import com.sdkforge.core.model.TypeDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds declarations for named plan types and the runtime types every generated SDK uses.
 */
public final class TypeDefinitionBuilder {

    private static final String ENTITY = "type";

    private TypeDefinitionBuilder() {
        // Utility class
    }

    /**
     * Builds the declaration for one plan type.
     *
     * <p>{@code INTERFACE} types become an interface with one property per field, optionality
     * mirrored from the field. {@code ENUM} types become an enum with one member per value.
     *
     * @param type type descriptor
     * @return interface or enum declaration
     * @throws com.sdkforge.core.error.PlanConstructionException if the type name or a
     *         field/value name is missing
     */
    public static Declaration build(TypeDescriptor type) {
        Objects.requireNonNull(type, "type must not be null");
        String name = requireField(type.name(), ENTITY, "<unnamed>", "name");

        return switch (type.kind()) {
            case INTERFACE -> new InterfaceDeclaration(name, List.of(), fields(name, type.fields()),
                type.exported(), type.description());
            case ENUM -> new EnumDeclaration(name, members(name, type.enumValues()),
                type.exported(), type.description());
        };
    }

    private static List<PropertyDeclaration> fields(String typeName, List<FieldDescriptor> fields) {
        List<PropertyDeclaration> properties = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            FieldDescriptor field = fields.get(i);
            String fieldId = typeName + "#" + i;
            String fieldName = requireField(field.name(), "field", fieldId, "name");
            String fieldType = requireField(field.type(), "field", typeName + "." + fieldName, "type");
            properties.add(PropertyDeclaration.field(fieldName, fieldType, field.optional()));
        }
        return properties;
    }

    private static List<EnumMember> members(String typeName, List<EnumValueDescriptor> values) {
        List<EnumMember> members = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            EnumValueDescriptor value = values.get(i);
            String memberName = requireField(value.name(), "enum value", typeName + "#" + i, "name");
            members.add(new EnumMember(memberName, value.value() != null ? value.value() : memberName));
        }
        return members;
    }

    /**
     * Builds the runtime support types referenced by the client: {@code Logger},
     * {@code AuthHandler}, {@code APIResponse}, {@code HttpClient} and {@code BearerAuthHandler}.
     *
     * @return support declarations in emission order
     */
    public static List<Declaration> buildSupportTypes() {
        InterfaceDeclaration logger = new InterfaceDeclaration("Logger", List.of(), List.of(
            PropertyDeclaration.field("debug", "(message: string, ...args: unknown[]) => void", false),
            PropertyDeclaration.field("info", "(message: string, ...args: unknown[]) => void", false),
            PropertyDeclaration.field("warn", "(message: string, ...args: unknown[]) => void", false),
            PropertyDeclaration.field("error", "(message: string, ...args: unknown[]) => void", false)
        ), true, "Pluggable logger used by the client");

        InterfaceDeclaration authHandler = new InterfaceDeclaration("AuthHandler", List.of(), List.of(
            PropertyDeclaration.field("headers", "() => Record<string, string>", false)
        ), true, "Supplies authentication headers for outgoing requests");

        InterfaceDeclaration apiResponse = new InterfaceDeclaration("APIResponse<T>", List.of(), List.of(
            PropertyDeclaration.field("data", "T", false),
            PropertyDeclaration.field("status", "number", false),
            PropertyDeclaration.field("headers", "Record<string, string>", false),
            PropertyDeclaration.field("requestId", "string", true)
        ), true, "Envelope returned by the transport for every call");

        String verb = "<T>(url: string, payload?: Record<string, unknown>) => Promise<APIResponse<T>>";
        InterfaceDeclaration httpClient = new InterfaceDeclaration("HttpClient", List.of(), List.of(
            PropertyDeclaration.field("get", verb, false),
            PropertyDeclaration.field("post", verb, false),
            PropertyDeclaration.field("put", verb, false),
            PropertyDeclaration.field("patch", verb, false),
            PropertyDeclaration.field("delete", verb, false)
        ), true, "Transport used by the client");

        ClassDeclaration bearer = new ClassDeclaration(
            "BearerAuthHandler",
            null,
            List.of("AuthHandler"),
            List.of(new PropertyDeclaration("token", "string", null, true, true, false)),
            new Constructor(List.of(param("token", "string")), List.of(assign("this.token", "token"))),
            List.of(new MethodDeclaration(
                "headers",
                List.of(),
                "Record<string, string>",
                List.of(new ReturnStatement(new ObjectExpression(List.of(
                    ObjectProperty.raw("Authorization", "\"Bearer \" + this.token"))))),
                false,
                false,
                DocComment.of("Bearer token header")
            )),
            true,
            "Sends the API key as a bearer token"
        );

        return List.of(logger, authHandler, apiResponse, httpClient, bearer);
    }
}
