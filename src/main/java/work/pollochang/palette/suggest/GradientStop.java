package work.pollochang.palette.suggest;

import work.pollochang.palette.model.Color;

/**
 * @param color    色標顏色
 * @param position 位置 0–100
 */
public record GradientStop(Color color, double position) {}
