package com.deepansh.kernel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A single block inside a {@link Message}. Which fields are populated depends on {@link #type}:
 * <ul>
 *   <li>text: {@code text}</li>
 *   <li>tool_use: {@code id}, {@code name}, {@code input}</li>
 *   <li>tool_result: {@code toolUseId}, {@code content}, {@code error}</li>
 *   <li>image: {@code mediaType}, {@code data} (base64)</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentBlock {

    public enum Type {
        text, tool_use, tool_result, image
    }

    private Type type;

    private String text;

    private String id;
    private String name;
    private Map<String, Object> input;

    private String toolUseId;
    private String content;
    private boolean error;

    private String mediaType;
    private String data;

    public static ContentBlock text(String text) {
        return ContentBlock.builder().type(Type.text).text(text).build();
    }

    public static ContentBlock toolUse(String id, String name, Map<String, Object> input) {
        return ContentBlock.builder().type(Type.tool_use).id(id).name(name)
                .input(input != null ? input : Map.of())
                .build();
    }

    public static ContentBlock toolResult(String toolUseId, String content, boolean error) {
        return ContentBlock.builder().type(Type.tool_result).toolUseId(toolUseId)
                .content(content).error(error)
                .build();
    }

    public static ContentBlock image(String mediaType, String base64Data) {
        return ContentBlock.builder().type(Type.image).mediaType(mediaType).data(base64Data).build();
    }

    @JsonIgnore
    public int charLength() {
        if (type == null) return 0;
        return switch (type) {
            case text -> text != null ? text.length() : 0;
            case tool_use -> (name != null ? name.length() : 0) + (input != null ? input.toString().length() : 0);
            case tool_result -> content != null ? content.length() : 0;
            // Images are billed by the provider, not by characters; count a flat cost.
            case image -> 4000;
        };
    }
}
