package work.pollochang.palette.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import work.pollochang.palette.core.ColorSpace;
import work.pollochang.palette.exception.InvalidColorFormatException;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.Hsl;
import work.pollochang.palette.model.Rgb;

import java.io.IOException;

/**
 * {@link Color} 的 Jackson 模組。
 * <p>
 * 輸出格式為 {@code {hex, rgb, hsl, name?, percentage?}}。
 * 讀取時以 {@code hex} 為準推導 RGB，{@code rgb} 欄位只作為輸出資訊，不被信任。
 */
public class ColorJsonModule extends SimpleModule {

    public ColorJsonModule() {
        super("ColorJsonModule");
        addSerializer(Color.class, new ColorSerializer());
        addDeserializer(Color.class, new ColorDeserializer());
    }

    static class ColorSerializer extends StdSerializer<Color> {

        ColorSerializer() {
            super(Color.class);
        }

        @Override
        public void serialize(Color value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("hex", value.hex());
            provider.defaultSerializeField("rgb", value.rgb(), gen);
            provider.defaultSerializeField("hsl", value.hsl(), gen);
            if (value.name() != null) {
                gen.writeStringField("name", value.name());
            }
            if (value.percentage() != null) {
                gen.writeNumberField("percentage", value.percentage());
            }
            gen.writeEndObject();
        }
    }

    static class ColorDeserializer extends StdDeserializer<Color> {

        ColorDeserializer() {
            super(Color.class);
        }

        @Override
        public Color deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);
            JsonNode hexNode = node.get("hex");
            if (hexNode == null || !hexNode.isTextual()) {
                throw JsonMappingException.from(p, "Color 缺少 hex 欄位");
            }

            Rgb rgb;
            try {
                rgb = ColorSpace.hexToRgb(hexNode.textValue());
            } catch (InvalidColorFormatException e) {
                // 保留原始輸入字串，方便上層定位錯誤資料
                throw JsonMappingException.from(p, e.getMessage(), e);
            }

            JsonNode hslNode = node.get("hsl");
            Hsl hsl = hslNode != null && hslNode.isObject()
                    ? new Hsl(hslNode.path("h").asInt(), hslNode.path("s").asInt(), hslNode.path("l").asInt())
                    : ColorSpace.rgbToHsl(rgb);

            JsonNode nameNode = node.get("name");
            String name = nameNode != null && nameNode.isTextual() ? nameNode.textValue() : null;

            JsonNode percentageNode = node.get("percentage");
            Double percentage = percentageNode != null && percentageNode.isNumber() ? percentageNode.doubleValue() : null;

            return new Color(rgb, hsl, name, percentage);
        }
    }
}
