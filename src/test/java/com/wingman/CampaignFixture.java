package com.wingman;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a small but complete campaign folder plus a matching simulator mission folder.
 * <p>
 * Reference pilot 2000001 (Hans Weber) has two combat reports; only the first one has a mission
 * data record. Karl Allmenroder and Kurt Wolff tie on four victories in the aces file.
 */
public final class CampaignFixture {
    public static final String REFERENCE_SERIAL = "2000001";
    public static final String CAMPAIGN_NAME = "Jasta Spring";
    public static final String SQUADRON_ID = "401011";
    public static final String MISSION_FILE = "Hans Weber_1917-04-14.mission";

    private CampaignFixture() {
    }

    public static Path writeCampaign(Path parent) throws IOException {
        Path root = parent.resolve("Jasta Spring");
        Files.createDirectories(root);

        Files.writeString(root.resolve("Campaign.json"), """
            {"name":"Jasta Spring","date":"19170415","referencePlayerSerialNumber":2000001,
             "referencePlayerSquadronId":401011,"product":"FC"}
            """);
        Files.writeString(root.resolve("CampaignAces.json"), """
            {"acesInCampaign":[
              {"serialNumber":2000001,"name":"Hans Weber","rank":"Ltn","squadronId":401011,
               "squadronName":"Jasta 11","missionFlown":3,"victories":2},
              {"serialNumber":2000002,"name":"Ltn Karl Allmenroder","squadronId":401011,"victories":4},
              {"serialNumber":2000003,"name":"Kurt Wolff","squadronId":401011,"victories":4}
            ]}
            """);
        Files.writeString(root.resolve("CampaignLog.json"), """
            {"campaignLogsByDate":{
              "19170415":{"logs":[{"log":"Karl Allmenroder scored","squadronId":401011},{"log":"Weather poor"}]},
              "19170414":{"logs":[{"log":"Campaign started"}]}
            }}
            """);

        Path reports = root.resolve("CombatReports").resolve(REFERENCE_SERIAL);
        Files.createDirectories(reports);
        Files.writeString(reports.resolve("report-01.json"), """
            {"pilotSerialNumber":2000001,"reportPilotName":"Hans Weber","date":"19170414","time":"10:30:00",
             "squadron":"Jasta 11","type":"Albatros D.III","duty":"PATROL",
             "haReport":"Patrol over Arras\\nThis mission was flown by\\nLtn Hans Weber\\nLtn Kurt Wolff\\n\\nEnd",
             "victories":[{"category":"Fighter"}],"losses":[]}
            """);
        Files.writeString(reports.resolve("report-02.json"), """
            {"pilotSerialNumber":2000001,"reportPilotName":"Hans Weber","date":"19170415","time":"08:00:00",
             "squadron":"Jasta 11","type":"Albatros D.III","duty":"INTERCEPT",
             "victories":[{"category":"Bomber"}],"losses":[]}
            """);

        Path missions = root.resolve("MissionData");
        Files.createDirectories(missions);
        Files.writeString(missions.resolve("mission-01.json"), """
            {"missionHeader":{"date":"19170414","time":"10:30:00","squadronId":401011,"squadron":"Jasta 11",
              "aircraftType":"Albatros D.III","duty":"PATROL","missionFileName":"Hans Weber_1917-04-14.mission"},
             "missionDescription":"Patrol the front near Arras",
             "missionPlanes":{"1":{"pilotName":"Hans Weber","pilotSerialNumber":2000001},
                              "2":{"pilotName":"Kurt Wolff","pilotSerialNumber":2000003}}}
            """);

        Path personnel = root.resolve("Personnel");
        Files.createDirectories(personnel);
        Files.writeString(personnel.resolve(SQUADRON_ID + ".json"), """
            {"active":[{"serialNumber":2000002,"name":"Karl Allmenroder","rank":"Ltn"}],
             "wounded":[{"serialNumber":2000004,"name":"Otto Brauneck","victories":1}]}
            """);
        return root;
    }

    public static Path writeMissionFolder(Path parent) throws IOException {
        Path folder = parent.resolve("Missions");
        Files.createDirectories(folder);
        Files.writeString(folder.resolve(MISSION_FILE), """
            Mission
            {
              Options
              {
                LCName = 0;
                Time = 10:30:0;
                Date = 14.4.1917;
                CloudLevel = 1500;
                CloudHeight = 600;
                Temperature = 8;
                Pressure = 760;
                WindLayers
                {
                  0 :     270 :     2;
                  500 :     280 :     5;
                }
              }
            }
            """);
        return folder;
    }
}
