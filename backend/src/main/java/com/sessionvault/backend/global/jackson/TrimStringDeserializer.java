package com.sessionvault.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 로그인 이메일처럼 앞뒤 공백이 의미 없는 식별자 필드용 역직렬화기
 *
 * - 앞뒤 공백을 잘라낸 값을 돌려준다. 대소문자 정규화는 AuthSessionService 몫이다.
 * - 공백만 있던 값은 null로 바꾼다. 그러면 @NotBlank 하나로 "없음"과 "공백"이 같은 400이 된다.
 */
public class TrimStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        String raw = parser.getValueAsString();
        if (raw == null) {
            return null;
        }
        String trimmed = raw.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
