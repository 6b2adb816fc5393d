package com.astmark.core.lexer;

import com.astmark.core.marker.MarkingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenStream 单元测试
 */
class TokenStreamTest {

    // 0 foo, 1 (, 2 bar, 3 ), 4 COMMENT, 5 NEWLINE, 6 ENDMARKER
    private static final String SOURCE = "foo(bar)  # c\n";

    private final TokenStream stream = new TokenStream(SOURCE, new Lexer(SOURCE, "<test>").scanTokens());

    private List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::getText).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("位置查找")
    class LookupTests {

        @Test
        @DisplayName("按偏移查找：取起始不大于偏移的最后一个 token")
        void testTokenAtOffset() {
            assertEquals("foo", stream.tokenAtOffset(0).getText());
            assertEquals("bar", stream.tokenAtOffset(5).getText());
            // 空白归前一个 token
            assertEquals(")", stream.tokenAtOffset(8).getText());
        }

        @Test
        @DisplayName("按行列查找")
        void testTokenAt() {
            assertEquals("bar", stream.tokenAt(1, 5).getText());
            assertEquals(TokenType.COMMENT, stream.tokenAt(1, 11).getType());
        }

        @Test
        @DisplayName("空流返回 null")
        void testEmptyStream() {
            TokenStream empty = new TokenStream("", Collections.<Token>emptyList());
            assertNull(empty.tokenAtOffset(0));
        }

        @Test
        @DisplayName("token 序号与位置不一致时拒绝构建")
        void testIndexMismatch() {
            List<Token> tokens = Arrays.asList(
                    new Token(TokenType.NAME, "a", 1, 1, 0, 0),
                    new Token(TokenType.NAME, "b", 1, 3, 2, 5));
            assertThrows(IllegalArgumentException.class, () -> new TokenStream("a b", tokens));
        }
    }

    @Nested
    @DisplayName("步进")
    class SteppingTests {

        @Test
        @DisplayName("默认跳过注释")
        void testNextSkipsExtra() {
            Token close = stream.get(3);
            assertEquals(TokenType.NEWLINE, stream.next(close).getType());
            assertEquals(TokenType.COMMENT, stream.next(close, true).getType());
            assertEquals(")", stream.prev(stream.get(5)).getText());
        }

        @Test
        @DisplayName("越过首尾时抛出 STREAM_BOUNDARY")
        void testBoundaries() {
            MarkingException e = assertThrows(MarkingException.class, () -> stream.prev(stream.get(0)));
            assertEquals(MarkingException.Reason.STREAM_BOUNDARY, e.getReason());
            assertThatThrownBy(() -> stream.next(stream.get(6)))
                    .isInstanceOf(MarkingException.class);
        }
    }

    @Nested
    @DisplayName("搜索")
    class FindTests {

        @Test
        @DisplayName("正向搜索包含起点")
        void testFindForward() {
            assertEquals(3, stream.find(stream.get(0), TokenType.OP, ")", false).getIndex());
            assertEquals(1, stream.find(stream.get(1), TokenType.OP, null, false).getIndex());
        }

        @Test
        @DisplayName("反向搜索")
        void testFindReverse() {
            assertEquals(0, stream.find(stream.get(2), TokenType.NAME, "foo", true).getIndex());
        }

        @Test
        @DisplayName("找不到时报告期望的 token")
        void testFindFails() {
            MarkingException e = assertThrows(MarkingException.class,
                    () -> stream.find(stream.get(0), TokenType.OP, "[", false));
            assertEquals(MarkingException.Reason.STREAM_BOUNDARY, e.getReason());
            assertEquals("OP '['", e.getExpected());
        }

        @Test
        @DisplayName("断言 token 类型与文本")
        void testExpect() {
            Token bar = stream.get(2);
            assertSame(bar, stream.expect(bar, TokenType.NAME, "bar"));
            assertSame(bar, stream.expect(bar, TokenType.NAME, null));
            MarkingException e = assertThrows(MarkingException.class,
                    () -> stream.expect(bar, TokenType.NAME, "baz"));
            assertEquals(MarkingException.Reason.MALFORMED_INPUT, e.getReason());
            assertThat(e.getMessage()).contains("found 'bar'").contains("expected: NAME 'baz'");
        }
    }

    @Nested
    @DisplayName("区间")
    class RangeTests {

        @Test
        @DisplayName("闭区间，默认不含注释")
        void testRange() {
            assertEquals(Arrays.asList("foo", "(", "bar", ")", "\n"),
                    texts(stream.range(stream.get(0), stream.get(5))));
            assertEquals(6, stream.range(stream.get(0), stream.get(5), true).size());
        }

        @Test
        @DisplayName("起点在终点之后时为空")
        void testEmptyRange() {
            assertTrue(stream.range(stream.get(2), stream.get(0)).isEmpty());
            assertEquals("", stream.text(stream.get(2), stream.get(0)));
        }

        @Test
        @DisplayName("区间文本是源码的精确子串")
        void testText() {
            assertEquals("foo(bar)", stream.text(stream.get(0), stream.get(3)));
            assertEquals("bar", stream.text(stream.get(2), stream.get(2)));
        }
    }
}
