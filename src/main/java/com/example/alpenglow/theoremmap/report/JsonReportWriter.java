package com.example.alpenglow.theoremmap.report;

import com.example.alpenglow.theoremmap.model.MappingReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/** Full nested dump of the report with snake_case keys. */
@Component
public class JsonReportWriter implements ReportWriter {

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String fileName() {
        return ReportFormats.BASE_NAME + ".json";
    }

    @Override
    public int order() {
        return 0;
    }

    @Override
    public void write(MappingReport report, Path target) throws IOException {
        OBJECT_MAPPER.writeValue(target.toFile(), report);
    }
}
