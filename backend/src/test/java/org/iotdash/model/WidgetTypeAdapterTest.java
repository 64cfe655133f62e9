package org.iotdash.model;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.iotdash.util.Json;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WidgetTypeAdapterTest {

    @Test
    void modelledMembersBecomeFields() {
        Widget widget = Json.gson().fromJson(
                "{\"id\":\"w1\",\"type\":\"chart\",\"title\":\"T\",\"topic\":\"a/b\",\"x\":1,\"y\":2.5,\"w\":3,\"h\":4,"
                        + "\"data\":{\"points\":[]},\"config\":{\"unit\":\"C\"}}", Widget.class);

        assertEquals("w1", widget.getId());
        assertEquals("a/b", widget.getTopic());
        assertEquals(2.5, widget.getY().doubleValue());
        assertEquals("C", widget.getConfig().get("unit").getAsString());
        assertEquals(0, widget.getExtra().size());
    }

    @Test
    void unknownAndMistypedMembersAreWrittenBackUnchanged() {
        String json = "{\"id\":\"w1\",\"x\":0,\"mqttTopic\":\"home/temp\",\"minW\":1,\"color\":\"red\","
                + "\"layout\":{\"static\":true},\"title\":7,\"data\":[1,2]}";

        Widget widget = Json.gson().fromJson(json, Widget.class);
        JsonObject written = Json.gson().toJsonTree(widget).getAsJsonObject();

        assertEquals(JsonParser.parseString(json), written);
        assertNull(widget.getTitle());
        assertNull(widget.getData());
    }

    @Test
    void numbersKeepTheirTextualForm() {
        Widget widget = Json.gson().fromJson("{\"x\":0,\"w\":12}", Widget.class);
        assertEquals("{\"x\":0,\"w\":12}", Json.gson().toJson(widget));
    }

    @Test
    void copyIsDeep() {
        Widget widget = Json.gson().fromJson("{\"id\":\"w1\",\"style\":{\"color\":\"red\"}}", Widget.class);
        Widget copy = widget.copy();

        widget.getExtra().getAsJsonObject("style").addProperty("color", "blue");

        assertEquals("red", copy.getExtra().getAsJsonObject("style").get("color").getAsString());
        assertEquals("w1", copy.getId());
    }

    @Test
    void nonObjectWidgetIsRejected() {
        assertThrows(JsonParseException.class, () -> Json.gson().fromJson("\"gauge\"", Widget.class));
        assertNull(Json.gson().fromJson("null", Widget.class));
    }
}
