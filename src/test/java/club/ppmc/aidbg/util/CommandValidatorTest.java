package club.ppmc.aidbg.util;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CommandValidatorTest {

    @Test
    void acceptsPlainCommandUnchanged() {
        Result<String> result = CommandValidator.validateCommand("bp 0x401000");
        assertTrue(result.isSuccess());
        assertEquals("bp 0x401000", result.getValue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"bp 1; run", "r rax | more", "a & b", "`x`", "$(ls)", "a > b", "\"q\"", "'q'", "a\nb"})
    void rejectsShellMetacharacters(String command) {
        Result<String> result = CommandValidator.validateCommand(command);
        assertTrue(result.isError());
        assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"a;b", "a|b", "a&b", "a`b", "a$b", "a(b", "a)b", "a<b", "a>b", "a\"b", "a'b", "a\nb", "a\rb", "a\0b"})
    void rejectsEachForbiddenCharacterOnItsOwn(String command) {
        assertEquals(ErrorKind.VALIDATION, CommandValidator.validateCommand(command).getErrorKind());
    }

    @Test
    void rejectsEmptyAndOversizedCommands() {
        assertEquals(ErrorKind.VALIDATION, CommandValidator.validateCommand("").getErrorKind());
        assertEquals(ErrorKind.VALIDATION, CommandValidator.validateCommand(null).getErrorKind());
        assertTrue(CommandValidator.validateCommand("a".repeat(CommandValidator.MAX_COMMAND_LENGTH)).isSuccess());
        assertEquals(
                ErrorKind.VALIDATION,
                CommandValidator.validateCommand("a".repeat(CommandValidator.MAX_COMMAND_LENGTH + 1)).getErrorKind());
    }

    @Test
    void rejectsNonAscii() {
        assertTrue(CommandValidator.validateCommand("comment 注释").isError());
        assertTrue(CommandValidator.validateCommand("a\tb").isError());
    }

    @Test
    void memoryRangeBoundaries() {
        assertTrue(CommandValidator.validateMemoryRange(0x1000, 1).isSuccess());
        assertTrue(CommandValidator.validateMemoryRange(0x1000, CommandValidator.MAX_MEMORY_SIZE).isSuccess());
        assertTrue(CommandValidator.validateMemoryRange(0, 16).isError());
        assertTrue(CommandValidator.validateMemoryRange(0x1000, 0).isError());
        assertTrue(CommandValidator.validateMemoryRange(0x1000, -1).isError());
        assertTrue(CommandValidator.validateMemoryRange(0x1000, CommandValidator.MAX_MEMORY_SIZE + 1L).isError());
    }

    @Test
    void memoryRangeRejectsUnsignedWrapAround() {
        Result<Void> result = CommandValidator.validateMemoryRange(0xFFFFFFFFFFFFFFF0L, 0x20);
        assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
        assertTrue(CommandValidator.validateMemoryRange(0xFFFFFFFFFFFFFF00L, 0x20).isSuccess());
    }

    @Test
    void stripsControlCharactersButKeepsLayout() {
        assertEquals("a\tb\nc", CommandValidator.stripControlCharacters("a\tb\r\nc\u0007\u007f"));
        assertEquals("", CommandValidator.stripControlCharacters(null));
    }
}
