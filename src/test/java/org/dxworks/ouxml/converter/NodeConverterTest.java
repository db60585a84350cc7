package org.dxworks.ouxml.converter;

import org.dxworks.ouxml.converter.math.MathTranslator;
import org.dxworks.ouxml.model.ContentNode;
import org.dxworks.ouxml.model.NodeKind;
import org.dxworks.ouxml.reader.OuXmlReader;
import org.dxworks.ouxml.report.Diagnostic;
import org.dxworks.ouxml.report.DiagnosticCollector;
import org.dxworks.ouxml.report.DiagnosticType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeConverterTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final DeferredOutputQueue deferred = new DeferredOutputQueue();

    private List<String> convert(String xml) {
        return convert(OuXmlReader.read(xml), MathTranslator.none());
    }

    private List<String> convertFirstChild(String xml) {
        return convert(OuXmlReader.read(xml).getChildren().get(0), MathTranslator.none());
    }

    private List<String> convert(ContentNode node, MathTranslator math) {
        NodeConverter converter = new NodeConverter(ConversionSettings.of(5, 1), math, diagnostics);
        return converter.convert(node, Indent.NONE, deferred);
    }

    // ---------- headings ----------

    @Test
    void sessionTitle_isUnderlinedWithEquals() {
        assertEquals(List.of("Getting started", "===============", ""),
                convertFirstChild("<Session><Title>Getting started</Title></Session>"));
    }

    @Test
    void sectionTitle_isUnderlinedWithDashes() {
        assertEquals(List.of("Key ideas", "---------", ""),
                convertFirstChild("<Section><Title> Key ideas </Title></Section>"));
    }

    @Test
    void lineBreakInTitle_becomesSpace() {
        assertEquals(List.of("Part one and two", "================", ""),
                convertFirstChild("<Session><Title>Part one<br/>and two</Title></Session>"));
    }

    @Test
    void lineBreakInBoxHeading_becomesSpace() {
        assertEquals(List.of(".. admonition:: Read this first", "", "    Body", ""),
                convert("<Box><Heading>Read this<br/> first</Heading><Paragraph>Body</Paragraph></Box>"));
    }

    @Test
    void subSectionTitle_isUnderlinedWithTildes() {
        assertEquals(List.of("Detail", "~~~~~~", ""),
                convertFirstChild("<SubSection><Title>Detail</Title></SubSection>"));
    }

    @Test
    void titleInOtherContext_fallsBackAndIsReported() {
        assertEquals(List.of("Odd", "^^^", ""), convertFirstChild("<Unit><Title>Odd</Title></Unit>"));
        assertEquals(1, diagnostics.count(DiagnosticType.UNRECOGNIZED_HEADING_CONTEXT));
    }

    // ---------- paragraphs and inline markup ----------

    @Test
    void trailingSpace_movesOutOfEmphasis() {
        assertEquals(List.of("This is *very* important.", ""),
                convert("<Paragraph>This is <i>very </i>important.</Paragraph>"));
    }

    @Test
    void trailingSpace_becomesTailWhenNoneExists() {
        assertEquals(List.of("Ends with **bold**", ""),
                convert("<Paragraph>Ends with <b>bold </b></Paragraph>"));
    }

    @Test
    void severalTrailingSpaces_allMoveOutOfEmphasis() {
        assertEquals(List.of("a *word*  b", ""), convert("<Paragraph>a <i>word  </i>b</Paragraph>"));
    }

    @Test
    void leadingSpace_movesBeforeOpeningDelimiter() {
        assertEquals(List.of("a **bold** b", ""), convert("<Paragraph>a<b> bold</b> b</Paragraph>"));
    }

    @Test
    void surroundingSpaces_leaveLinkMarkupIntact() {
        assertEquals(List.of("See `the site <http://x.org>`_ now", ""),
                convert("<Paragraph>See<a href=\"http://x.org\"> the site </a>now</Paragraph>"));
    }

    @Test
    void whitespaceOnlyFormatting_isKeptAsPlainText() {
        assertEquals(List.of("a b", ""), convert("<Paragraph>a<i> </i>b</Paragraph>"));
    }

    @Test
    void superscriptSubscriptAndGlossaryTerms() {
        assertEquals(List.of("E = mc:sup:`2` and H:sub:`2`O are :term:`formulae`", ""),
                convert("<Paragraph>E = mc<sup>2</sup> and H<sub>2</sub>O are <GlossaryTerm>formulae</GlossaryTerm></Paragraph>"));
    }

    @Test
    void hyperlink() {
        assertEquals(List.of("See `the site <http://x.org>`_.", ""),
                convert("<Paragraph>See <a href=\"http://x.org\">the site</a>.</Paragraph>"));
    }

    @Test
    void hyperlinkWithoutHref_keepsOnlyTail() {
        assertEquals(List.of("See .", ""), convert("<Paragraph>See <a>nothing</a>.</Paragraph>"));
    }

    @Test
    void crossReference_resolvesDocumentPath() {
        assertEquals(List.of("Read :doc:`this </block2/part3/unit1/index>` now.", ""),
                convert("<Paragraph>Read <olink targetdoc=\"Block 2, Part 3, Unit 1\">this</olink> now.</Paragraph>"));
    }

    @Test
    void lineBreak_startsNewLineAtCurrentIndent() {
        assertEquals(List.of("first", "second", ""), convert("<Paragraph>first<br/> second</Paragraph>"));
    }

    @Test
    void inlineComputerCode() {
        assertEquals(List.of("Run ``ls`` now", ""),
                convert("<Paragraph>Run <ComputerCode>ls</ComputerCode> now</Paragraph>"));
    }

    @Test
    void multiLineComputerCode_becomesSourceBlock() {
        assertEquals(List.of(".. sourcecode::", "", "    a = 1", "", "    b = 2", ""),
                convert("<ComputerCode>a = 1\n\nb = 2\n</ComputerCode>"));
    }

    // ---------- containers ----------

    @Test
    void boxWithHeading_becomesAdmonition() {
        assertEquals(List.of(".. admonition:: Tip", "", "    Read it.", ""),
                convert("<Box><Heading>Tip</Heading><Paragraph>Read it.</Paragraph></Box>"));
    }

    @Test
    void boxWithoutHeading_becomesNote() {
        assertEquals(List.of(".. note::", "", "    Plain.", ""),
                convert("<Box><Paragraph>Plain.</Paragraph></Box>"));
    }

    @Test
    void activityWithQuestionAndAnswer() {
        assertEquals(List.of(
                        ".. activity:: Activity 1",
                        "",
                        "    Why?",
                        "",
                        "    .. activity-answer::",
                        "",
                        "        Because.",
                        ""),
                convert("<Activity><Heading>Activity 1</Heading>"
                        + "<Question><Paragraph>Why?</Paragraph></Question>"
                        + "<Answer><Paragraph>Because.</Paragraph></Answer></Activity>"));
    }

    @Test
    void quoteIsIndentedWithAttribution() {
        assertEquals(List.of("    Words", "", "    -- Author", ""),
                convert("<Quote><Paragraph>Words</Paragraph><SourceReference>Author</SourceReference></Quote>"));
    }

    // ---------- lists ----------

    @Test
    void bulletedList() {
        assertEquals(List.of("* One", "* Two", ""),
                convert("<BulletedList><ListItem>One</ListItem><ListItem>Two</ListItem></BulletedList>"));
    }

    @Test
    void numberedList() {
        assertEquals(List.of("#. One", "#. Two", ""),
                convert("<NumberedList><ListItem>One</ListItem><ListItem>Two</ListItem></NumberedList>"));
    }

    @Test
    void continuationLines_alignWithItemText() {
        assertEquals(List.of("* Line", "  next", ""),
                convert("<BulletedList><ListItem>Line<br/>next</ListItem></BulletedList>"));
    }

    @Test
    void numberedContinuationLines_arePaddedToMarkerWidth() {
        assertEquals(List.of("#. Line", "   next", "#. Other", ""),
                convert("<NumberedList><ListItem>Line<br/>next</ListItem><ListItem>Other</ListItem></NumberedList>"));
    }

    @Test
    void lineBreakInBoxItem_keepsNestedPadding() {
        assertEquals(List.of(".. note::", "", "    * Line", "      next", ""),
                convert("<Box><BulletedList><ListItem>Line<br/>next</ListItem></BulletedList></Box>"));
    }

    @Test
    void nestedList_isIndentedUnderItsItem() {
        assertEquals(List.of("* Parent", "", "  * Child", ""),
                convert("<BulletedList><ListItem>Parent<BulletedSubsidiaryList>"
                        + "<SubListItem>Child</SubListItem></BulletedSubsidiaryList></ListItem></BulletedList>"));
    }

    @Test
    void itemStartingWithBlock_carriesMarkerOnFirstLine() {
        assertEquals(List.of("#. First", "", "   Second", ""),
                convert("<NumberedList><ListItem><Paragraph>First</Paragraph>"
                        + "<Paragraph>Second</Paragraph></ListItem></NumberedList>"));
    }

    // ---------- media ----------

    @Test
    void figure_usesFileBaseNameAndCaption() {
        assertEquals(List.of(".. figure:: fig1.png", "", "    A chart", ""),
                convert("<Figure><Image src=\"C:\\imgs\\fig1.png\"/><Caption>A chart</Caption></Figure>"));
    }

    @Test
    void image_usesFileBaseName() {
        assertEquals(List.of(".. image:: z.png", ""), convert("<Image src=\"https://x/y/z.png\"/>"));
    }

    @Test
    void imageWithoutSource_isDropped() {
        assertEquals(List.of(), convert("<Image/>"));
    }

    @Test
    void inlineFigure_definesSubstitutionOnce() {
        assertEquals(List.of("Icon |icon.png| here and |icon.png|", ""),
                convert("<Paragraph>Icon <InlineFigure><Image src=\"imgs/icon.png\"/></InlineFigure> here and "
                        + "<InlineFigure><Image src=\"imgs/icon.png\"/></InlineFigure></Paragraph>"));
        assertEquals(List.of(".. |icon.png| image:: icon.png", ""), deferred.lines());
    }

    @Test
    void youtubeMedia_withDescription() {
        assertEquals(List.of(".. youtube:: abc123", "", "    .. description::", "", "        Intro", ""),
                convert("<MediaContent src=\"youtube:abc123\"><Description><Paragraph>Intro</Paragraph>"
                        + "</Description></MediaContent>"));
    }

    @Test
    void embeddedMedia_keepsUrlAndSize() {
        assertEquals(List.of(
                        ".. iframe:: https://example.org/embed",
                        "    :width: 640",
                        "    :height: 480",
                        "",
                        "    Demo",
                        ""),
                convert("<MediaContent src=\"https://example.org/embed\" width=\"640\" height=\"480\">"
                        + "<Caption>Demo</Caption></MediaContent>"));
    }

    // ---------- tables ----------

    @Test
    void table_becomesListTableWithHeaderRows() {
        assertEquals(List.of(
                        ".. list-table:: Results",
                        "    :header-rows: 1",
                        "",
                        "    * - Name",
                        "      - Score",
                        "    * - Ann",
                        "      - 9",
                        ""),
                convert("<Table><TableHead>Results</TableHead><tbody>"
                        + "<tr><th>Name</th><th>Score</th></tr>"
                        + "<tr><td>Ann</td><td>9</td></tr></tbody></Table>"));
    }

    @Test
    void headerRows_countRowsWithHeaderCells() {
        ContentNode table = OuXmlReader.read("<Table><tr><th>a</th></tr><tr><td>b</td><th>c</th></tr>"
                + "<tr><td>d</td></tr></Table>");
        assertEquals(2, NodeConverter.countHeaderRows(table.findAllChildren(NodeKind.ROW)));
    }

    @Test
    void tableWithoutRows_rendersNothing() {
        assertEquals(List.of(), convert("<Table><TableHead>Empty</TableHead></Table>"));
    }

    // ---------- equations ----------

    @Test
    void equation_rewritesDisplayDelimiters() {
        MathTranslator stub = mathml -> Optional.of("\\[x^2\\]");
        ContentNode equation = OuXmlReader.read("<Equation><MathML><math><mi>x</mi></math></MathML></Equation>");
        assertEquals(List.of("$$x^2$$", ""), convert(equation, stub));
    }

    @Test
    void equation_removesNewlinesAndDoublesBackslashes() {
        MathTranslator stub = mathml -> Optional.of("\\[\\frac{1}{2}\n\\]");
        ContentNode equation = OuXmlReader.read("<Equation><MathML><math/></MathML></Equation>");
        assertEquals(List.of("$$\\\\frac{1}{2}$$", ""), convert(equation, stub));
    }

    @Test
    void untranslatableEquation_isDropped() {
        assertEquals(List.of(), convert("<Equation><MathML><math/></MathML></Equation>"));
    }

    // ---------- unrecognized content ----------

    @Test
    void unknownElement_producesNothingAndIsReported() {
        assertEquals(List.of(), convert("<Mystery><Paragraph>lost</Paragraph></Mystery>"));
        List<Diagnostic> reported = diagnostics.getDiagnostics();
        assertEquals(1, reported.size());
        assertEquals(DiagnosticType.UNRECOGNIZED_ELEMENT, reported.get(0).type);
        assertEquals("Mystery", reported.get(0).element);
    }

    @Test
    void unknownElement_doesNotStopItsSiblings() {
        assertEquals(List.of(".. note::", "", "    Kept", ""),
                convert("<Box><Mystery><Paragraph>lost</Paragraph></Mystery><Paragraph>Kept</Paragraph></Box>"));
        assertEquals(1, diagnostics.count(DiagnosticType.UNRECOGNIZED_ELEMENT));
        assertEquals("Box", diagnostics.getDiagnostics().get(0).parent);
    }

    @Test
    void unknownElementInList_isReportedAndItemsStillRendered() {
        assertEquals(List.of("* a", "* b", ""),
                convert("<BulletedList><ListItem>a</ListItem><Mystery>x</Mystery><ListItem>b</ListItem></BulletedList>"));
        assertEquals(1, diagnostics.count(DiagnosticType.UNRECOGNIZED_ELEMENT));
        assertEquals("BulletedList", diagnostics.getDiagnostics().get(0).parent);
    }

    @Test
    void unknownElementsInTable_areReportedAndCellsStillRendered() {
        assertEquals(List.of(
                        ".. list-table::",
                        "    :header-rows: 0",
                        "",
                        "    * - a",
                        "      - b",
                        ""),
                convert("<Table><tr><td>a</td><Mystery>m</Mystery><td>b</td></tr><Mystery2/>"
                        + "<tbody><Mystery3/></tbody></Table>"));
        assertEquals(3, diagnostics.count(DiagnosticType.UNRECOGNIZED_ELEMENT));
    }

    @Test
    void equationMarkup_staysOnOneLine() {
        MathTranslator stub = mathml -> Optional.of("\\[a\n+\nb\\]");
        List<String> lines = convert(OuXmlReader.read("<Equation><MathML><math/></MathML></Equation>"), stub);
        assertTrue(lines.get(0).indexOf('\n') < 0);
    }
}
