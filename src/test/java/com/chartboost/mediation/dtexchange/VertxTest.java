package com.chartboost.mediation.dtexchange;

import com.chartboost.mediation.dtexchange.json.JacksonMapper;
import com.chartboost.mediation.dtexchange.json.ObjectMapperProvider;
import com.fasterxml.jackson.databind.ObjectMapper;

public abstract class VertxTest {

    protected static ObjectMapper mapper;
    protected static JacksonMapper jacksonMapper;

    static {
        mapper = ObjectMapperProvider.mapper();
        jacksonMapper = new JacksonMapper(mapper);
    }
}
