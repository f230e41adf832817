package io.sm2env.application.render;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;

/**
 * Pretty printer with platform-independent line feeds and {@code {}} for empty objects.
 */
final class StablePrettyPrinter extends DefaultPrettyPrinter {
  private static final long serialVersionUID = 1L;

  StablePrettyPrinter() {
    _objectIndenter = new DefaultIndenter("  ", "\n");
  }

  private StablePrettyPrinter(StablePrettyPrinter base) {
    super(base);
  }

  @Override
  public DefaultPrettyPrinter createInstance() {
    return new StablePrettyPrinter(this);
  }

  @Override
  public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
    if (nrOfEntries > 0) {
      super.writeEndObject(g, nrOfEntries);
      return;
    }
    if (!_objectIndenter.isInline()) {
      --_nesting;
    }
    g.writeRaw('}');
  }
}
