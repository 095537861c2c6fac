package com.example.alpenglow.theoremmap.processor;

import com.example.alpenglow.theoremmap.model.MappingContext;
import reactor.core.publisher.Mono;

public interface MappingStage {
    String name();
    Mono<MappingContext> process(MappingContext ctx);
}
