package com.goormthonuniv.sentinel.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.sentinel.exception.JudgmentFormatException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 판정 서비스의 타입 지정 진입점. 자격증명 회전은 {@link CredentialRotationManager}가 맡는다.
 * <p>
 * JSON 응답은 코드펜스를 벗긴 뒤 레코드로 역직렬화하고 Bean Validation으로 검사한다.
 * 하나라도 어긋나면 부분 결과를 쓰지 않고 {@link JudgmentFormatException}을 던진다.
 */
@Component
public class JudgmentGateway {

    private static final Pattern FENCE_START = Pattern.compile("^```(?:json)?\\s*", Pattern.MULTILINE);
    private static final Pattern FENCE_END = Pattern.compile("\\s*```\\s*$", Pattern.MULTILINE);

    private final CredentialRotationManager rotationManager;
    private final ObjectMapper om;
    private final Validator validator;

    public JudgmentGateway(CredentialRotationManager rotationManager, ObjectMapper objectMapper, Validator validator) {
        this.rotationManager = rotationManager;
        this.om = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true);
        this.validator = validator;
    }

    public String generate(String model, String prompt, JudgmentOptions options) {
        return rotationManager.invoke(model, prompt, options);
    }

    public <T> T generateJson(String model, String prompt, JudgmentOptions options, Class<T> type) {
        return parse(generate(model, prompt, options), om.getTypeFactory().constructType(type));
    }

    <T> T parse(String raw, JavaType type) {
        String cleaned = stripFences(raw);
        T value;
        try {
            value = om.readValue(cleaned, type);
        } catch (Exception e) {
            throw new JudgmentFormatException("Judgment output is not valid " + type.getRawClass().getSimpleName(), e);
        }
        if (value == null) {
            throw new JudgmentFormatException("Judgment output is empty");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new JudgmentFormatException("Judgment output failed validation: " + detail);
        }
        return value;
    }

    static String stripFences(String raw) {
        if (raw == null) return "";
        String s = FENCE_START.matcher(raw.strip()).replaceAll("");
        return FENCE_END.matcher(s).replaceAll("").strip();
    }
}
