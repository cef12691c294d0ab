package com.layoutparser.generator.synthesis;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * The lines produced for one record, in layout order.
 */
@Value
public class RecordSynthesis {
    int recordIndex;
    List<SynthesizedLine> lines;
    List<UnresolvedDefect> defects;

    public List<String> contents() {
        return lines.stream().map(SynthesizedLine::getContent).toList();
    }

    public String concatenated() {
        return lines.stream().map(SynthesizedLine::getContent).collect(Collectors.joining());
    }
}
