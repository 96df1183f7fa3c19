package com.testlantern.tree;

import com.testlantern.support.Dumps;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DebugTreeParserTest {

    private DebugTreeParser parser;

    @BeforeClass
    public void setUp() {
        parser = new DebugTreeParser();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Well-formed dumps
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void parse_loginTree_placesEveryLine() {
        TreeParseResult result = parser.parse(Dumps.LOGIN_TREE);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getProblems()).isEmpty();
        assertThat(result.getNodeCount()).isEqualTo(7);
        assertThat(result.requireRoot().preorder()).hasSize(7);
    }

    @Test
    public void parse_loginTree_childDepthIsParentDepthPlusOne() {
        ElementNode root = parser.parse(Dumps.LOGIN_TREE).requireRoot();

        for (ElementNode node : root.preorder()) {
            for (ElementNode child : node.getChildren()) {
                assertThat(child.getDepth()).isEqualTo(node.getDepth() + 1);
                assertThat(child.getParent()).containsSame(node);
            }
        }
    }

    @Test
    public void parse_loginTree_keepsDumpOrder() {
        ElementNode root = parser.parse(Dumps.LOGIN_TREE).requireRoot();

        List<String> handles = root.preorder().stream()
            .map(ElementNode::getHandleHex)
            .collect(Collectors.toList());
        assertThat(handles).containsExactly(
            "0x7f81", "0x7f82", "0x7f83", "0x7f84", "0x7f85", "0x7f86", "0x7f87");
    }

    @Test
    public void parse_blankLinesAndCrLf_areIgnored() {
        String dump = " →Application 0x1: \r\n\r\n    Button 0x2: \r\n";

        TreeParseResult result = parser.parse(dump);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.requireRoot().getChildren()).hasSize(1);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Structural problems
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void parse_depthJump_skipsLineAndLaterSiblingReattaches() {
        String dump = String.join("\n",
            " →Application 0x1: ",
            "    Window 0x2: ",
            "      Button 0x3: ",
            "        Cell 0x4: ",
            "                    Image 0x5: ",
            "      Button 0x6: ");

        TreeParseResult result = parser.parse(dump);

        assertThat(result.isPartial()).isTrue();
        assertThat(result.getProblems()).extracting(ParseProblem::kind).containsExactly(ParseProblem.Kind.DEPTH_JUMP);
        assertThat(result.getProblems().get(0).lineNumber()).isEqualTo(5);
        assertThat(result.getNodeCount()).isEqualTo(5);

        ElementNode window = result.requireRoot().getChildren().get(0);
        assertThat(window.getChildren()).extracting(ElementNode::getHandleHex).containsExactly("0x3", "0x6");
    }

    @Test
    public void parse_secondRoot_isOutsideRoot() {
        String dump = " →Application 0x1: \n    Window 0x2: \n →Application 0x3: ";

        TreeParseResult result = parser.parse(dump);

        assertThat(result.isPartial()).isTrue();
        assertThat(result.getProblems()).extracting(ParseProblem::kind).containsExactly(ParseProblem.Kind.OUTSIDE_ROOT);
        assertThat(result.getProblems().get(0).isFatal()).isFalse();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Rejected dumps
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void parse_malformedLines_areAllReportedAndNoTreeIsBuilt() {
        String dump = String.join("\n",
            " →Application 0x1: ",
            "garbage one",
            "    Button 0x2: ",
            "garbage two");

        TreeParseResult result = parser.parse(dump);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getRoot()).isEmpty();
        assertThat(result.getProblems()).extracting(ParseProblem::lineNumber).containsExactly(2, 4);
        assertThat(result.getProblems()).allMatch(ParseProblem::isFatal);
    }

    @Test
    public void parse_emptyDump_failsWithEmptyDump() {
        TreeParseResult result = parser.parse("\n  \n");

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getProblems()).extracting(ParseProblem::kind).containsExactly(ParseProblem.Kind.EMPTY_DUMP);
    }

    @Test
    public void requireRoot_onFailedResult_throwsWithEveryProblem() {
        TreeParseResult result = parser.parse("bad\nworse");

        assertThatThrownBy(result::requireRoot)
            .isInstanceOf(TreeParseException.class)
            .hasMessageContaining("line 1")
            .hasMessageContaining("line 2");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Full debug descriptions
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void fromDebugDescription_parsesOnlyTheElementSubtree() {
        TreeParseResult result = parser.fromDebugDescription(Dumps.LOGIN_DESCRIPTION);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getNodeCount()).isEqualTo(7);
    }

    @Test
    public void fromDebugDescription_withoutSubtree_failsWithMissingSection() {
        TreeParseResult result = parser.fromDebugDescription("Attributes: Application, 0x1\nQuery chain:\n →Find: app");

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getProblems()).extracting(ParseProblem::kind)
            .containsExactly(ParseProblem.Kind.MISSING_SECTION);
    }
}
