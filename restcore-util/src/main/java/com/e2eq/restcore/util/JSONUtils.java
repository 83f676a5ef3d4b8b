package com.e2eq.restcore.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bson.types.ObjectId;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Shared Jackson mapper for request bodies and response documents.
 *
 * <p>Dates are written as ISO-8601 strings, ObjectIds as their hex form and byte arrays as UTF-8
 * text.</p>
 */
public class JSONUtils {
   private static final JSONUtils instance = new JSONUtils();
   private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

   protected ObjectMapper mapper;

   private JSONUtils() {
      SimpleModule module = new SimpleModule("restcore");
      module.addSerializer(ObjectId.class, ToStringSerializer.instance);
      module.addSerializer(byte[].class, new Utf8BytesSerializer());

      mapper = new ObjectMapper();
      mapper.registerModule(new JavaTimeModule());
      mapper.registerModule(module);
      mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
      mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
   }

   public static JSONUtils instance() {
      return instance;
   }

   public ObjectMapper getMapper() {
      return mapper;
   }

   public String toJson(Object value) throws JsonProcessingException {
      return mapper.writeValueAsString(value);
   }

   /**
    * Parses a JSON object. Anything other than an object at the top level is rejected.
    */
   public Map<String, Object> readMap(byte[] body) throws IOException {
      return mapper.readValue(body, MAP_TYPE);
   }

   public Map<String, Object> readMap(String body) throws JsonProcessingException {
      return mapper.readValue(body, MAP_TYPE);
   }

   static final class Utf8BytesSerializer extends JsonSerializer<byte[]> {
      @Override
      public void serialize(byte[] value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
         gen.writeString(new String(value, StandardCharsets.UTF_8));
      }
   }
}
