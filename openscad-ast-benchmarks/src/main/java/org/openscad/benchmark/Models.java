package org.openscad.benchmark;

/**
 * OpenSCAD sources shared by the benchmarks.
 */
final class Models {

    static final String SMALL = "sphere(r = 10, $fn = 20);";

    static final String BRACKET = String.join("\n",
            "$fn = 48;",
            "thickness = 3;",
            "module hole(d) { cylinder(h = 10, d = d, center = true); }",
            "difference() {",
            "    union() {",
            "        cube([40, 20, 3]);",
            "        translate([0, 17, 0]) cube([40, 3, 25]);",
            "    }",
            "    for (x = [8 : 12 : 32]) translate([x, 10, 0]) hole(5);",
            "    translate([20, 21, 15]) rotate([90, 0, 0]) cylinder(h = 10, r = 4);",
            "}");

    private Models() {
    }

    /**
     * {@code count} copies of a small part placed along x, each with its own transform chain.
     */
    static String grid(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append("translate([").append(i * 12).append(", 0, 0]) rotate(").append(i % 360)
                    .append(") color(\"steelblue\") difference() { cube(10, center = true); sphere(d = 12); }\n");
        }
        return sb.toString();
    }
}
