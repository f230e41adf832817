package io.sm2env.application.render;

import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.SecretValue;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.reader.StreamReader;

/**
 * Renders secrets as block-style YAML.
 *
 * <p>The document is built as an explicit node graph so that every value is tagged {@code !!str}; values such as
 * {@code 5432}, {@code true} or {@code null} therefore load back as strings. Multi-line values use literal block
 * style when they can be represented that way and fall back to double quotes otherwise.</p>
 *
 * @since 0.1.0
 */
public final class YamlEncoder extends AbstractSecretEncoder {
  private static final Logger log = LoggerFactory.getLogger(YamlEncoder.class);

  static final String BINARY_SIZE_FIELD = "binary_size_bytes";

  private final Yaml yaml;

  public YamlEncoder() {
    super(OutputFormat.YAML);
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setLineBreak(DumperOptions.LineBreak.UNIX);
    options.setSplitLines(false);
    this.yaml = new Yaml(options);
  }

  @Override
  EncodedOutput encodeMap(Map<String, String> entries) {
    List<NodeTuple> tuples = new ArrayList<>(entries.size());
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      tuples.add(new NodeTuple(
          scalar(Tag.STR, entry.getKey(), DumperOptions.ScalarStyle.PLAIN),
          valueNode(entry.getKey(), entry.getValue())));
    }
    return serialize(new MappingNode(Tag.MAP, tuples, DumperOptions.FlowStyle.BLOCK));
  }

  @Override
  EncodedOutput encodeText(String text) {
    return serialize(valueNode(VALUE_FIELD, text));
  }

  @Override
  EncodedOutput encodeBinary(SecretValue.Binary binary) {
    List<NodeTuple> tuples = List.of(new NodeTuple(
        scalar(Tag.STR, BINARY_SIZE_FIELD, DumperOptions.ScalarStyle.PLAIN),
        scalar(Tag.INT, Integer.toString(binary.size()), DumperOptions.ScalarStyle.PLAIN)));
    return serialize(new MappingNode(Tag.MAP, tuples, DumperOptions.FlowStyle.BLOCK));
  }

  private Node valueNode(String field, String value) {
    if (!hasLineBreak(value) && StreamReader.isPrintable(value)) {
      return scalar(Tag.STR, value, DumperOptions.ScalarStyle.PLAIN);
    }
    try {
      requireLiteralBlockSafe(field, value);
      return scalar(Tag.STR, value, DumperOptions.ScalarStyle.LITERAL);
    } catch (EncodingException ex) {
      log.debug("YAML field '{}' falls back to double-quoted style: {}", field, ex.getMessage());
      return scalar(Tag.STR, value, DumperOptions.ScalarStyle.DOUBLE_QUOTED);
    }
  }

  /**
   * Verifies that a multi-line value survives a literal block scalar unchanged.
   *
   * @param field field name used in the failure message
   * @param value candidate value
   * @throws EncodingException when the value needs escapes a block scalar cannot carry
   */
  void requireLiteralBlockSafe(String field, String value) throws EncodingException {
    if (!StreamReader.isPrintable(value)) {
      throw new EncodingException(field, format(), "contains non-printable characters");
    }
    if (value.indexOf('\n') < 0) {
      throw new EncodingException(field, format(), "has no newline to split into block lines");
    }
    if (value.chars().anyMatch(c -> c != '\n' && isLineBreak(c))) {
      throw new EncodingException(field, format(), "contains a line break other than LF");
    }
    if (value.startsWith(" ")) {
      throw new EncodingException(field, format(), "starts with a space");
    }
    for (String line : value.split("\n", -1)) {
      if (!line.isEmpty() && Character.isWhitespace(line.charAt(line.length() - 1))) {
        throw new EncodingException(field, format(), "has trailing whitespace on a line");
      }
    }
  }

  private static boolean hasLineBreak(String value) {
    return value.chars().anyMatch(YamlEncoder::isLineBreak);
  }

  /** YAML 1.1 line breaks; a loader folds or normalizes any of them outside double quotes. */
  private static boolean isLineBreak(int c) {
    return c == '\n' || c == '\r' || c == '\u0085' || c == '\u2028' || c == '\u2029';
  }

  private EncodedOutput serialize(Node root) {
    StringWriter writer = new StringWriter();
    yaml.serialize(root, writer);
    return utf8(writer.toString());
  }

  private static ScalarNode scalar(Tag tag, String value, DumperOptions.ScalarStyle style) {
    return new ScalarNode(tag, value, null, null, style);
  }
}
