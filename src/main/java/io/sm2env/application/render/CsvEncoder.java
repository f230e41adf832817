package io.sm2env.application.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.SecretValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders secrets as RFC 4180 CSV with a {@code key,value} header and {@code \n} record terminators.
 *
 * <p>Fields are quoted only when they hold a comma, double quote, CR or LF; inner quotes are doubled. The header is
 * written as an ordinary first row so an empty map still yields {@code key,value}.</p>
 *
 * @since 0.1.0
 */
public final class CsvEncoder extends AbstractSecretEncoder {
  static final String TEXT_KEY = "value";
  static final String BINARY_KEY = "binary_size_bytes";
  private static final String[] HEADER = {"key", "value"};

  private final ObjectWriter writer;

  public CsvEncoder() {
    super(OutputFormat.CSV);
    CsvMapper mapper = CsvMapper.builder()
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .build();
    this.writer = mapper.writer(CsvSchema.emptySchema().withLineSeparator("\n").withoutHeader());
  }

  @Override
  EncodedOutput encodeMap(Map<String, String> entries) throws EncodingException {
    List<String[]> rows = new ArrayList<>(entries.size() + 1);
    rows.add(HEADER);
    entries.forEach((key, value) -> rows.add(new String[] {key, value}));
    return write(rows, VALUE_FIELD);
  }

  @Override
  EncodedOutput encodeText(String text) throws EncodingException {
    return write(List.of(HEADER, new String[] {TEXT_KEY, text}), VALUE_FIELD);
  }

  @Override
  EncodedOutput encodeBinary(SecretValue.Binary binary) throws EncodingException {
    return write(List.of(HEADER, new String[] {BINARY_KEY, Integer.toString(binary.size())}), BINARY_KEY);
  }

  private EncodedOutput write(List<String[]> rows, String field) throws EncodingException {
    try {
      return utf8(writer.writeValueAsString(rows));
    } catch (JsonProcessingException ex) {
      throw new EncodingException(field, format(), "CSV generation failed: " + ex.getOriginalMessage());
    }
  }
}
