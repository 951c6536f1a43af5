package com.questrail.poolheat.cloud.transport.fairland;

/**
 * Fairland cloud response bodies, trimmed from captured traffic.
 */
public final class FairlandFixtures {

    private FairlandFixtures() {
    }

    public static final String LOGIN_OK = """
            {"code":200000,"msg":"success","data":{"authorization":"Bearer abc123","userId":"u-1"}}
            """;

    public static final String LOGIN_BAD_PASSWORD = """
            {"code":400105,"msg":"account or password error","data":null}
            """;

    public static final String GROUPS = """
            {"code":200000,"msg":"success","data":[
              {"id":"g-1","name":"Home","deviceCount":2},
              {"id":"g-2","name":"Holiday","deviceCount":1}
            ]}
            """;

    public static final String GROUP_1_DEVICES = """
            {"code":200000,"msg":"success","data":{"bindDeviceInfos":[
              {"id":"hp-1","deviceName":"Pool","categoryCode":"heatPump","version":"1.0.3","sn":"SN-1"},
              {"id":"lamp-1","deviceName":"Lamp","categoryCode":"light","version":"2.0","sn":"SN-L"}
            ]}}
            """;

    public static final String GROUP_2_DEVICES = """
            {"code":200000,"msg":"success","data":{"bindDeviceInfos":[
              {"id":"hp-1","deviceName":"Pool","categoryCode":"heatPump","version":"1.0.3","sn":"SN-1"},
              {"id":"hp-2","deviceName":"Spa","categoryCode":"heatPump","version":"1.0.1","sn":"SN-2"}
            ]}}
            """;

    public static final String DATA_POINTS = """
            {"code":200000,"msg":"success","data":[
              {"dpId":"101","dpValue":true,"dpMode":"rw","dpProperty":""},
              {"dpId":"102","dpValue":1,"dpMode":"rw","dpProperty":"{\\"0\\":\\"Smart\\",\\"1\\":\\"Silent\\",\\"2\\":\\"Boost\\"}"},
              {"dpId":"103","dpValue":"24.5","dpMode":"ro","dpProperty":"{\\"min\\":-30,\\"max\\":99,\\"step\\":0.5}"},
              {"dpId":"106","dpValue":1,"dpMode":"rw","dpProperty":"{\\"min\\":0,\\"max\\":2,\\"step\\":1}"},
              {"dpId":"107","dpValue":28,"dpMode":"rw","dpProperty":"{\\"min\\":15,\\"max\\":40,\\"step\\":1}"},
              {"dpId":"112","dpValue":1250,"dpMode":"ro","dpProperty":"{\\"scale\\":3}"},
              {"dpId":"140","dpValue":0,"dpMode":"ro","dpType":"fault","dpProperty":""},
              {"dpId":"141","dpValue":4,"dpMode":"ro","dpProperty":"{\\"type\\":\\"fault\\"}"},
              {"dpId":"150","dpValue":7,"dpMode":"ro","dpProperty":""}
            ]}
            """;

    public static final String SET_OK = """
            {"code":200000,"msg":"success","data":null}
            """;

    public static final String CLOUD_ERROR = """
            {"code":500001,"msg":"device offline","data":null}
            """;
}
