package bytedfa.ucd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import bytedfa.util.IntRange;
import bytedfa.util.IntRangeSet;
import java.io.IOException;
import java.io.StringReader;
import java.util.Map;
import java.util.Optional;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class UcdPropertiesTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static UcdProperties properties;

  @BeforeClass
  public static void load() throws IOException {
    properties = UcdProperties.load(UcdTestData.directory());
  }

  private static IntRangeSet gcb(String value) {
    return properties.enumerated("gcb", value).orElseThrow();
  }

  @Test
  public void enumeratedValues() {
    assertThat(gcb("CR"), is(IntRangeSet.of(IntRange.single(0x0D))));
    assertThat(gcb("LF"), is(IntRangeSet.of(IntRange.single(0x0A))));
    assertThat(gcb("Extend").contains(0x0300), is(true));
    assertThat(gcb("Extend").contains('a'), is(false));
  }

  @Test
  public void looseMatching() {
    assertThat(
      properties.enumerated("Grapheme Cluster Break", "regional-indicator"),
      is(Optional.of(gcb("Regional_Indicator")))
    );
    assertThat(properties.enumerated("GCB", "extend"), is(Optional.of(gcb("Extend"))));
  }

  @Test
  public void shortValueAliases() {
    assertThat(gcb("RI").contains(0x1F1E6), is(true));
    assertThat(gcb("EX"), is(gcb("Extend")));
    assertThat(gcb("XX"), is(gcb("Other")));
  }

  @Test
  public void otherCoversUnlistedCodePoints() {
    final IntRangeSet other = gcb("Other");
    assertThat(other.contains('a'), is(true));
    assertThat(other.contains(0x10FFFF), is(true));
    assertThat(other.contains(0x0D), is(false));
    assertThat(other.contains(0x0300), is(false));
    assertThat(other.contains(0xAC00), is(false));
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownValue() {
    properties.enumerated("gcb", "Nope");
  }

  @Test
  public void unloadedPropertiesAreUnknown() {
    assertThat(properties.enumerated("wb", "ALetter"), is(Optional.empty()));
    assertThat(properties.enumerated("script", "Greek"), is(Optional.empty()));
  }

  @Test
  public void binaryProperties() {
    final IntRangeSet pictographic = properties.binary("Extended_Pictographic").orElseThrow();
    assertThat(pictographic.contains(0xA9), is(true));
    assertThat(pictographic.contains('a'), is(false));
    assertThat(properties.binary("ExtPict"), is(Optional.of(pictographic)));
    assertThat(properties.binary("Emoji_Nope"), is(Optional.empty()));
  }

  @Test
  public void emptyDirectory() throws IOException {
    final UcdProperties empty = UcdProperties.load(folder.getRoot().toPath());
    assertThat(empty.enumerated("gcb", "CR"), is(Optional.empty()));
    assertThat(empty.binary("Extended_Pictographic"), is(Optional.empty()));
  }

  @Test
  public void parsePropertyFile() throws IOException {
    final Map<String, IntRangeSet> parsed = UcdPropertyFile.parse(
      new StringReader(String.join("\n",
        "# comment",
        "",
        "0041..0043 ; Upper # A..C",
        "0061       ; Lower",
        "0044       ; Upper"
      )),
      "test.txt"
    );
    assertThat(parsed.keySet().toString(), is("[Upper, Lower]"));
    assertThat(parsed.get("Upper"), is(IntRangeSet.of(IntRange.between(0x41, 0x44))));
    assertThat(parsed.get("Lower"), is(IntRangeSet.of(IntRange.single(0x61))));
  }

  @Test
  public void malformedLineNamesFileAndLine() throws IOException {
    try {
      UcdPropertyFile.parse(new StringReader("0041 ; A\nZZZZ ; B\n"), "broken.txt");
      fail("expected a parse failure");
    } catch (UcdParseException e) {
      assertThat(e.source, is("broken.txt"));
      assertThat(e.lineNumber, is(2));
    }
  }

  @Test(expected = UcdParseException.class)
  public void missingValue() throws IOException {
    UcdPropertyFile.parse(new StringReader("0041\n"), "broken.txt");
  }
}
