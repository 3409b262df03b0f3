package com.rfqlog.domain.model;

import static com.rfqlog.domain.model.FieldDefinition.bool;
import static com.rfqlog.domain.model.FieldDefinition.choice;
import static com.rfqlog.domain.model.FieldDefinition.decimal;
import static com.rfqlog.domain.model.FieldDefinition.integer;
import static com.rfqlog.domain.model.FieldDefinition.text;

/**
 * Tracked fields of an RFQ part, in display order
 */
public final class PartFieldSchema {

    public static final FieldSchema PART = FieldSchema.of("part",
            text("name", "Name").asRequired(),
            text("part_number", "Part Number"),
            integer("material_id", "Material"),
            decimal("weight_g", "Weight (g)"),
            decimal("volume_cm3", "Volume (cm³)"),
            decimal("projected_area_cm2", "Projected Area (cm²)"),
            decimal("wall_thickness_mm", "Wall Thickness (mm)"),
            choice("wall_thickness_source", "Wall Thickness Source", "data", "given", "bom", "estimated"),
            choice("geometry_mode", "Geometry Mode", "direct", "box"),
            decimal("box_length_mm", "Box Length (mm)"),
            decimal("box_width_mm", "Box Width (mm)"),
            decimal("box_effective_percent", "Box Effective (%)"),
            integer("parts_over_runtime", "Parts over Runtime"),
            bool("assembly", "Assembly"),
            choice("degate", "Degate", "yes", "no", "maybe"),
            bool("overmold", "Overmold"),
            choice("eoat_type", "EOAT Type", "standard", "complex"),
            choice("surface_finish", "Surface Finish",
                    "draw_polish", "polish", "high_polish", "grain", "technical_polish", "edm"),
            text("surface_finish_detail", "Surface Finish Detail"),
            text("notes", "Notes"),
            text("remarks", "Remarks"),
            text("image_filename", "Image")
    );

    private PartFieldSchema() {
    }
}
