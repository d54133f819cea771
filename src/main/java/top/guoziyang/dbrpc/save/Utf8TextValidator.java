package top.guoziyang.dbrpc.save;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 文本文件校验：必须是合法的UTF-8，且不含NUL字符
 */
public class Utf8TextValidator implements ContentValidator {

    @Override
    public void validate(Path target, byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoder.decode(ByteBuffer.wrap(content));
        } catch (CharacterCodingException e) {
            throw DriverException.wrap(ErrorCode.INVALID_PARAMS, target + " is not valid UTF-8 text", e);
        }
        for (int i = 0; i < content.length; i++) {
            if (content[i] == 0) {
                throw DriverException.of(ErrorCode.INVALID_PARAMS, target + " contains a NUL byte at offset " + i);
            }
        }
    }
}
